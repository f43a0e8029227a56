package com.flamingo.inboundmail.service.storage;

/** Blob storage for attachment bytes. */
public interface AttachmentStorage {

  /**
   * Stores the bytes under the key, replacing any previous content.
   *
   * @param key relative key, e.g. {@code <eventId>/<ordinal>_<filename>}
   * @return opaque reference to pass to {@link #read(String)}
   * @throws com.flamingo.inboundmail.exception.AttachmentStorageException on write failure
   */
  String store(String key, byte[] content);

  /**
   * Reads previously stored bytes.
   *
   * @throws com.flamingo.inboundmail.exception.AttachmentStorageException if the reference cannot
   *     be read
   */
  byte[] read(String storageRef);
}
