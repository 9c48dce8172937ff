package com.flamingo.ai.memoryengine.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations and the consolidation schedule. */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

  /** Background enrichment (embedding, entity extraction) after ingest. */
  @Bean(name = "enrichmentExecutor")
  public Executor enrichmentExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("enrich-");
    executor.initialize();
    return executor;
  }

  /** Parallel candidate generation; one task per signal per search. */
  @Bean(name = "retrievalExecutor")
  public Executor retrievalExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("retrieval-");
    executor.initialize();
    return executor;
  }

  /**
   * Per-record consolidation work. Parallelism is capped by the scheduler's semaphore; the pool
   * only needs to be at least that large.
   */
  @Bean(name = "consolidationExecutor")
  public Executor consolidationExecutor(MemoryEngineConfig config) {
    int parallelism = config.getConsolidation().getMaxParallelism();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism);
    executor.setQueueCapacity(config.getConsolidation().getBatchSize());
    executor.setThreadNamePrefix("consolidate-");
    executor.initialize();
    return executor;
  }
}
