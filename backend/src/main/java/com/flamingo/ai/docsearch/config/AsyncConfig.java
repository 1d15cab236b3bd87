package com.flamingo.ai.docsearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the worker pool that fetches and extracts documents during a run. */
@Configuration
public class AsyncConfig {

  @Bean(name = "extractionExecutor")
  public ThreadPoolTaskExecutor extractionExecutor(DocSearchConfig config) {
    int workers = Math.max(1, config.getIndexing().getWorkerThreads());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    // One window of in-flight documents never exceeds the batch size
    executor.setQueueCapacity(Math.max(config.getIndexing().getBatchSize(), 1) * 2);
    executor.setThreadNamePrefix("extract-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
