package com.flamingo.inboundmail.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for extraction workers and the OCR calls they supervise. */
@Configuration
@EnableScheduling
public class AsyncConfig {

  /** One long-running thread per worker; nothing queues behind them. */
  @Bean(name = "extractionWorkerExecutor")
  public ThreadPoolTaskExecutor extractionWorkerExecutor(PipelineConfig pipelineConfig) {
    int concurrency = pipelineConfig.getWorker().getConcurrency();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency);
    executor.setMaxPoolSize(concurrency);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("extract-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  /**
   * Runs OCR calls so that workers can enforce the per-job timeout. Sized above the worker count
   * because a timed-out call may keep its thread until the engine notices the interrupt.
   */
  @Bean(name = "ocrExecutor")
  public ThreadPoolTaskExecutor ocrExecutor(PipelineConfig pipelineConfig) {
    int concurrency = pipelineConfig.getWorker().getConcurrency();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency);
    executor.setMaxPoolSize(concurrency * 2);
    executor.setQueueCapacity(concurrency * 2);
    executor.setThreadNamePrefix("ocr-");
    executor.initialize();
    return executor;
  }
}
