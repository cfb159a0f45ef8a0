package com.scholary.songgen.service;

import com.scholary.songgen.job.JobQueue;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * The single consumer of {@link JobQueue}. Jobs run strictly one at a time in submission order.
 *
 * <p>Started and stopped with the application context. A job that blows up is logged and the loop
 * moves on to the next one.
 */
@Component
public class JobWorker implements SmartLifecycle {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobWorker.class);

  private final JobQueue jobQueue;
  private final GenerationOrchestrator orchestrator;
  private final ThreadPoolTaskExecutor executor;

  private volatile boolean running;
  private Future<?> loop;

  public JobWorker(
      JobQueue jobQueue,
      GenerationOrchestrator orchestrator,
      @Qualifier("generationWorkerExecutor") ThreadPoolTaskExecutor executor) {
    this.jobQueue = jobQueue;
    this.orchestrator = orchestrator;
    this.executor = executor;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    loop = executor.submit(this::runLoop);
  }

  @Override
  public synchronized void stop() {
    running = false;
    if (loop != null) {
      loop.cancel(true);
      loop = null;
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  void runLoop() {
    LOGGER.info("Generation worker started");
    while (running && !Thread.currentThread().isInterrupted()) {
      String jobId;
      try {
        jobId = jobQueue.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      try {
        orchestrator.process(jobId);
      } catch (RuntimeException e) {
        LOGGER.error("Unhandled failure while processing job {}", jobId, e);
      }
    }
    LOGGER.info("Generation worker stopped");
  }
}
