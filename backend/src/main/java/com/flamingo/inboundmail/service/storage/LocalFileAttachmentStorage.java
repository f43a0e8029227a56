package com.flamingo.inboundmail.service.storage;

import com.flamingo.inboundmail.config.IngestConfig;
import com.flamingo.inboundmail.exception.AttachmentStorageException;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link AttachmentStorage} on the local filesystem, rooted at {@code ingest.storage.base-dir}. */
@Service
@Slf4j
public class LocalFileAttachmentStorage implements AttachmentStorage {

  static final String SCHEME = "file:";

  private final Path baseDir;

  public LocalFileAttachmentStorage(IngestConfig ingestConfig) {
    this.baseDir = Path.of(ingestConfig.getStorage().getBaseDir()).toAbsolutePath().normalize();
  }

  @Override
  @Retry(name = "attachmentStorage")
  public String store(String key, byte[] content) {
    Path target = resolve(key);
    try {
      Files.createDirectories(target.getParent());
      Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
      Files.write(temp, content);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("Stored {} bytes at {}", content.length, target);
      return SCHEME + baseDir.relativize(target).toString().replace('\\', '/');
    } catch (IOException e) {
      throw new AttachmentStorageException(key, "Failed to store attachment " + key, e);
    }
  }

  @Override
  public byte[] read(String storageRef) {
    if (storageRef == null || !storageRef.startsWith(SCHEME)) {
      throw new AttachmentStorageException(storageRef, "Unsupported storage reference", null);
    }
    Path source = resolve(storageRef.substring(SCHEME.length()));
    try {
      return Files.readAllBytes(source);
    } catch (IOException e) {
      throw new AttachmentStorageException(storageRef, "Failed to read attachment " + source, e);
    }
  }

  private Path resolve(String key) {
    Path resolved = baseDir.resolve(key).normalize();
    if (!resolved.startsWith(baseDir)) {
      throw new AttachmentStorageException(key, "Storage key escapes the base directory", null);
    }
    return resolved;
  }
}
