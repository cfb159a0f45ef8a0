package com.scholary.songgen.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread for the generation worker loop.
 *
 * <p>Exactly one thread: jobs share the GPU and must run one after another.
 */
@Configuration
public class WorkerConfig {

  @Bean(name = "generationWorkerExecutor")
  public ThreadPoolTaskExecutor generationWorkerExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("generation-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
