package com.flamingo.ai.checklist.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the extraction worker pool. */
@Configuration
public class AsyncConfig {

  /**
   * Worker pool for per-node extraction. The queue is unbounded so that large trees and
   * concurrent runs wait for a worker instead of being rejected; the pool size caps backend load.
   */
  @Bean(name = "extractionExecutor")
  public Executor extractionExecutor(ChecklistProperties properties) {
    int concurrency = Math.max(1, properties.getExtraction().getConcurrency());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency);
    executor.setMaxPoolSize(concurrency);
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("extract-");
    executor.initialize();
    return executor;
  }
}
