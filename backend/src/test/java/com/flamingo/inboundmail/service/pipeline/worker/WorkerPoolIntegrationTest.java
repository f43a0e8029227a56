package com.flamingo.inboundmail.service.pipeline.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.inboundmail.config.PipelineConfig;
import com.flamingo.inboundmail.domain.entity.Attachment;
import com.flamingo.inboundmail.domain.entity.BatchRun;
import com.flamingo.inboundmail.domain.enums.BatchOutcome;
import com.flamingo.inboundmail.domain.enums.JobState;
import com.flamingo.inboundmail.domain.repository.AttachmentRepository;
import com.flamingo.inboundmail.domain.repository.BatchRunRepository;
import com.flamingo.inboundmail.domain.repository.ExtractionJobRepository;
import com.flamingo.inboundmail.domain.repository.ExtractionResultRepository;
import com.flamingo.inboundmail.service.pipeline.batch.BatchCommitter;
import com.flamingo.inboundmail.service.pipeline.queue.JobQueue;
import com.flamingo.inboundmail.service.storage.AttachmentStorage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Drives the real worker pool over real PDFs in storage until the queue is drained. */
@SpringBootTest
class WorkerPoolIntegrationTest {

  private static final long DEADLINE_SECONDS = 30;

  @Autowired private WorkerPool workerPool;
  @Autowired private JobQueue jobQueue;
  @Autowired private BatchCommitter batchCommitter;
  @Autowired private AttachmentStorage attachmentStorage;
  @Autowired private PipelineConfig pipelineConfig;
  @Autowired private AttachmentRepository attachmentRepository;
  @Autowired private ExtractionJobRepository jobRepository;
  @Autowired private ExtractionResultRepository resultRepository;
  @Autowired private BatchRunRepository batchRunRepository;

  @Autowired
  @Qualifier("extractionWorkerExecutor")
  private ThreadPoolTaskExecutor workerExecutor;

  @Autowired
  @Qualifier("ocrExecutor")
  private ThreadPoolTaskExecutor ocrExecutor;

  private boolean originalSingleTransaction;
  private int originalBatchSize;
  private int originalFlushTimeout;

  @BeforeEach
  void setUp() {
    resultRepository.deleteAll();
    batchRunRepository.deleteAll();
    jobRepository.deleteAll();
    attachmentRepository.deleteAll();
    originalSingleTransaction = pipelineConfig.isUseSingleTransaction();
    originalBatchSize = pipelineConfig.getBatchCommitSize();
    originalFlushTimeout = pipelineConfig.getBatchFlushTimeoutSeconds();
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    workerPool.stop();
    awaitTrue(() -> workerExecutor.getActiveCount() == 0);
    pipelineConfig.setBatchFlushTimeoutSeconds(0);
    batchCommitter.flushExpiredBatches();

    pipelineConfig.setUseSingleTransaction(originalSingleTransaction);
    pipelineConfig.setBatchCommitSize(originalBatchSize);
    pipelineConfig.setBatchFlushTimeoutSeconds(originalFlushTimeout);
  }

  @Test
  @DisplayName("Three workers extract twelve documents in batches of five")
  void shouldDrainMoreJobsThanWorkers() throws Exception {
    pipelineConfig.setUseSingleTransaction(false);
    pipelineConfig.setBatchCommitSize(5);
    enqueuePdfs(12);

    workerPool.run(3);

    assertThat(workerPool.activeWorkers()).isEqualTo(3);
    awaitTrue(() -> jobRepository.countByState(JobState.SUCCEEDED) == 12);

    // the last batch holds two jobs and only closes on its flush timeout
    pipelineConfig.setBatchFlushTimeoutSeconds(0);
    awaitTrue(
        () -> {
          batchCommitter.flushExpiredBatches();
          return batchCommitter.activeBatchCount() == 0;
        });

    assertThat(resultRepository.findAll())
        .hasSize(12)
        .allSatisfy(
            result -> {
              assertThat(result.isSuccessful()).isTrue();
              assertThat(result.getText()).startsWith("Document ");
              assertThat(result.getPageCount()).isEqualTo(1);
            });
    assertThat(jobRepository.findAll())
        .allSatisfy(job -> assertThat(job.getAttemptCount()).isEqualTo(1));
    assertThat(batchRunRepository.findAll())
        .allSatisfy(run -> assertThat(run.getOutcome()).isEqualTo(BatchOutcome.COMMITTED))
        .extracting(BatchRun::getTotal)
        .containsExactlyInAnyOrder(5, 5, 2);
  }

  @Test
  @DisplayName("Should grow both executors to fit the requested concurrency")
  void shouldGrowExecutorsForConcurrency() {
    workerPool.run(10);

    assertThat(workerExecutor.getMaxPoolSize()).isGreaterThanOrEqualTo(10);
    assertThat(workerExecutor.getCorePoolSize()).isGreaterThanOrEqualTo(10);
    assertThat(ocrExecutor.getMaxPoolSize()).isGreaterThanOrEqualTo(20);
    assertThat(ocrExecutor.getCorePoolSize()).isGreaterThanOrEqualTo(10);
  }

  @Test
  @DisplayName("Should refuse to start twice")
  void shouldRejectSecondRun() {
    workerPool.run(1);

    assertThatThrownBy(() -> workerPool.run(1)).isInstanceOf(IllegalStateException.class);
  }

  private void enqueuePdfs(int count) throws IOException {
    UUID eventId = UUID.randomUUID();
    for (int i = 0; i < count; i++) {
      byte[] pdf = pdf("Document " + i);
      String storageRef = attachmentStorage.store(eventId + "/" + i, pdf);
      Attachment attachment =
          attachmentRepository.save(
              Attachment.builder()
                  .eventId(eventId)
                  .ordinal(i)
                  .filename("document-" + i + ".pdf")
                  .mediaType("application/pdf")
                  .sizeBytes(pdf.length)
                  .storageRef(storageRef)
                  .build());
      jobQueue.enqueue(attachment);
    }
  }

  private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(DEADLINE_SECONDS);
    while (!condition.getAsBoolean()) {
      assertThat(System.nanoTime()).as("condition not met in time").isLessThan(deadline);
      Thread.sleep(50);
    }
  }

  private static byte[] pdf(String text) throws IOException {
    try (PDDocument document = new PDDocument()) {
      PDPage page = new PDPage();
      document.addPage(page);
      try (PDPageContentStream content = new PDPageContentStream(document, page)) {
        content.beginText();
        content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
        content.newLineAtOffset(72, 700);
        content.showText(text);
        content.endText();
      }
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      document.save(out);
      return out.toByteArray();
    }
  }
}
