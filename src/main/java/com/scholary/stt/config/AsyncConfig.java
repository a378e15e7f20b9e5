package com.scholary.stt.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>{@code pipelineExecutor} runs chunk loops so the caller can enforce the deadline; its size is
 * the engine thread cap, which bounds how many requests are in flight at once. {@code jobExecutor}
 * runs background jobs submitted through the jobs API.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "pipelineExecutor")
  public AsyncTaskExecutor pipelineExecutor(TranscriptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.threadCap());
    executor.setMaxPoolSize(properties.threadCap());
    executor.setQueueCapacity(properties.threadCap() * 4);
    executor.setThreadNamePrefix("transcription-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "jobExecutor")
  public AsyncTaskExecutor jobExecutor(TranscriptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.threadCap());
    executor.setMaxPoolSize(properties.threadCap());
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("job-");
    executor.initialize();
    return executor;
  }
}
