package com.scholary.narrator.config;

import com.scholary.narrator.logging.MdcTaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for background execution.
 *
 * <p>Three pools keep the stages apart:
 *
 * <ul>
 *   <li>{@code conversionExecutor}: one task per submitted job, bounded queue
 *   <li>{@code synthesisExecutor}: chunk-level work driven by the sequencer
 *   <li>{@code synthesisCallExecutor}: the raw TTS calls, so a hung call can be abandoned when its
 *       per-chunk timeout expires
 * </ul>
 *
 * <p>Status polling never runs on any of these pools. Each pool carries the submitting thread's
 * MDC so job log lines keep their {@code jobId}.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "conversionExecutor", destroyMethod = "shutdown")
  public ThreadPoolTaskExecutor conversionExecutor(NarratorProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.conversionThreads());
    executor.setMaxPoolSize(properties.conversionThreads());
    executor.setQueueCapacity(properties.conversionQueueSize());
    executor.setThreadNamePrefix("conversion-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }

  @Bean(name = "synthesisExecutor", destroyMethod = "shutdown")
  public ThreadPoolTaskExecutor synthesisExecutor(NarratorProperties properties) {
    int threads = properties.conversionThreads() * properties.synthesis().parallelism();

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix("synthesis-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }

  @Bean(name = "synthesisCallExecutor", destroyMethod = "shutdown")
  public ThreadPoolTaskExecutor synthesisCallExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(0);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("synthesis-call-");
    executor.setDaemon(true);
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }
}
