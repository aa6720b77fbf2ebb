package com.flamingo.ai.knowledge.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async ingestion jobs and page-level workers. */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

  /** Runs whole ingestion jobs; one thread per in-flight document. */
  @Bean(name = "ingestionExecutor")
  public Executor ingestionExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("ingest-");
    executor.initialize();
    return executor;
  }

  /**
   * Normalizes and chunks individual pages. Kept separate from {@link #ingestionExecutor()} so a
   * job waiting on its pages never starves the pool its pages run on.
   */
  @Bean(name = "pageProcessingExecutor")
  public Executor pageProcessingExecutor(KnowledgeConfig knowledgeConfig) {
    int workers = knowledgeConfig.getIngestion().effectiveWorkerPoolSize();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("page-proc-");
    executor.initialize();
    return executor;
  }
}
