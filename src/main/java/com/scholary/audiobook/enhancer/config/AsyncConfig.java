package com.scholary.audiobook.enhancer.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded thread pool for async enhancement jobs.
 *
 * <p>Each job runs one document start to finish on a single thread.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(
      @Value("${async.threads:2}") int threads, @Value("${async.queueSize:50}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("enhancement-");
    executor.initialize();
    return executor;
  }
}
