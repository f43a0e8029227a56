package com.flamingo.inboundmail.service.pipeline.worker;

import com.flamingo.inboundmail.config.PipelineConfig;
import com.flamingo.inboundmail.domain.repository.AttachmentRepository;
import com.flamingo.inboundmail.service.pipeline.batch.BatchCommitter;
import com.flamingo.inboundmail.service.pipeline.batch.BatchSettlementService;
import com.flamingo.inboundmail.service.pipeline.ocr.OcrEngine;
import com.flamingo.inboundmail.service.pipeline.queue.JobQueue;
import com.flamingo.inboundmail.service.storage.AttachmentStorage;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs N {@link ExtractionWorker}s draining the job queue.
 *
 * <p>Started with the application context unless {@code pipeline.worker.auto-start} is false, in
 * which case {@link #run(int)} starts it explicitly. Batches are held in memory, so on start any
 * failed attempt still waiting for a batch from an earlier run is settled first.
 */
@Service
@Slf4j
public class WorkerPool implements SmartLifecycle {

  private final ThreadPoolTaskExecutor workerExecutor;
  private final ThreadPoolTaskExecutor ocrExecutor;
  private final JobQueue jobQueue;
  private final BatchCommitter batchCommitter;
  private final BatchSettlementService settlementService;
  private final AttachmentRepository attachmentRepository;
  private final AttachmentStorage attachmentStorage;
  private final OcrEngine ocrEngine;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  private final String instanceId = UUID.randomUUID().toString().substring(0, 8);
  private final List<ExtractionWorker> workers = new ArrayList<>();
  private final List<Future<?>> futures = new ArrayList<>();
  private volatile boolean running;

  public WorkerPool(
      @Qualifier("extractionWorkerExecutor") ThreadPoolTaskExecutor workerExecutor,
      @Qualifier("ocrExecutor") ThreadPoolTaskExecutor ocrExecutor,
      JobQueue jobQueue,
      BatchCommitter batchCommitter,
      BatchSettlementService settlementService,
      AttachmentRepository attachmentRepository,
      AttachmentStorage attachmentStorage,
      OcrEngine ocrEngine,
      PipelineConfig pipelineConfig,
      MeterRegistry meterRegistry) {
    this.workerExecutor = workerExecutor;
    this.ocrExecutor = ocrExecutor;
    this.jobQueue = jobQueue;
    this.batchCommitter = batchCommitter;
    this.settlementService = settlementService;
    this.attachmentRepository = attachmentRepository;
    this.attachmentStorage = attachmentStorage;
    this.ocrEngine = ocrEngine;
    this.pipelineConfig = pipelineConfig;
    this.meterRegistry = meterRegistry;
    Gauge.builder("extraction.workers.active", this, WorkerPool::activeWorkers)
        .register(meterRegistry);
  }

  /**
   * Starts {@code concurrency} workers.
   *
   * @throws IllegalStateException if the pool is already running
   */
  public synchronized void run(int concurrency) {
    if (running) {
      throw new IllegalStateException("Worker pool is already running");
    }
    if (concurrency < 1) {
      throw new IllegalArgumentException("Concurrency must be at least 1: " + concurrency);
    }
    warnOnShortLease();
    int recovered = settlementService.recoverOrphanedFailures();
    if (recovered > 0) {
      log.info("Settled {} failed jobs left waiting by an unfinished batch", recovered);
    }
    ensureCapacity(workerExecutor, concurrency, concurrency);
    // a timed-out OCR call may hold its thread until the engine notices the interrupt
    ensureCapacity(ocrExecutor, concurrency, concurrency * 2);

    for (int i = 0; i < concurrency; i++) {
      ExtractionWorker worker =
          new ExtractionWorker(
              "worker-" + instanceId + "-" + i,
              jobQueue,
              batchCommitter,
              settlementService,
              attachmentRepository,
              attachmentStorage,
              ocrEngine,
              ocrExecutor,
              pipelineConfig,
              meterRegistry);
      workers.add(worker);
      futures.add(workerExecutor.submit(worker));
    }
    running = true;
    log.info(
        "Worker pool started: {} workers, batch size {}, {} mode",
        concurrency,
        pipelineConfig.getBatchCommitSize(),
        pipelineConfig.commitMode());
  }

  @Override
  public void start() {
    run(pipelineConfig.getWorker().getConcurrency());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    workers.forEach(ExtractionWorker::stop);
    futures.forEach(future -> future.cancel(true));
    log.info("Worker pool stopping {} workers", workers.size());
    workers.clear();
    futures.clear();
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return pipelineConfig.getWorker().isAutoStart();
  }

  public synchronized int activeWorkers() {
    return (int) futures.stream().filter(future -> !future.isDone()).count();
  }

  private static void ensureCapacity(ThreadPoolTaskExecutor executor, int core, int max) {
    if (executor.getMaxPoolSize() < max) {
      executor.setMaxPoolSize(max);
    }
    if (executor.getCorePoolSize() < core) {
      executor.setCorePoolSize(core);
    }
  }

  private void warnOnShortLease() {
    long needed =
        (long) pipelineConfig.getWorker().getOcrTimeoutSeconds()
            + pipelineConfig.getBatchFlushTimeoutSeconds();
    if (pipelineConfig.getJobClaimLeaseSeconds() < needed) {
      log.warn(
          "job-claim-lease-seconds ({}) is shorter than the OCR timeout plus batch flush timeout"
              + " ({}s); claims may expire while a batch is still open",
          pipelineConfig.getJobClaimLeaseSeconds(),
          needed);
    }
  }
}
