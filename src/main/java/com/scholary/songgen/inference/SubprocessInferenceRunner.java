package com.scholary.songgen.inference;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs the inference script as a child process.
 *
 * <p>Combined stdout/stderr is drained on a separate thread while the caller waits, so a chatty
 * script cannot block on a full pipe. Every line is logged; lines containing a configured error
 * marker are collected and make the run unsuccessful. The process is killed if it outlives the
 * configured timeout.
 */
@Component
public class SubprocessInferenceRunner implements InferenceRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubprocessInferenceRunner.class);

  private static final long GOBBLER_FLUSH_MILLIS = 2_000;
  private static final int MAX_ERROR_LINES = 20;
  private static final long KILL_WAIT_MILLIS = 10_000;

  private final ProcessFactory processFactory;
  private final InferenceProperties properties;
  private final List<String> errorMarkers;

  @Autowired
  public SubprocessInferenceRunner(InferenceProperties properties) {
    this(new DefaultProcessFactory(), properties);
  }

  SubprocessInferenceRunner(ProcessFactory processFactory, InferenceProperties properties) {
    this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    this.properties = properties;
    this.errorMarkers =
        properties.errorMarkers().stream().map(m -> m.toLowerCase(Locale.ROOT)).toList();
  }

  @Override
  public InferenceResult run(List<String> command, String jobId) {
    Path workingDir = Path.of(properties.workingDir());
    Duration timeout = properties.timeout();
    LOGGER.info(
        "Starting inference: jobId={}, workingDir={}, command={}",
        jobId,
        workingDir,
        String.join(" ", command));

    long startNanos = System.nanoTime();
    Process process;
    try {
      process = processFactory.start(command, workingDir);
    } catch (IOException e) {
      throw new InferenceException("Failed to start inference process: " + e.getMessage(), e);
    }

    List<String> errorLines = Collections.synchronizedList(new ArrayList<>());
    Thread gobbler = startGobbler(process.getInputStream(), errorLines, jobId);

    try {
      boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        kill(process, jobId);
        throw new InferenceException(
            "Inference timed out after " + timeout.toSeconds() + "s for job " + jobId);
      }
      gobbler.join(GOBBLER_FLUSH_MILLIS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new InferenceException("Inference interrupted for job " + jobId, e);
    }

    int exitCode = process.exitValue();
    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
    List<String> errors;
    synchronized (errorLines) {
      errors = List.copyOf(errorLines);
    }

    if (exitCode != 0) {
      LOGGER.error("Inference failed: jobId={}, exitCode={}", jobId, exitCode);
    } else if (!errors.isEmpty()) {
      LOGGER.error(
          "Inference exited 0 but printed {} error lines: jobId={}", errors.size(), jobId);
    } else {
      LOGGER.info("Inference finished: jobId={}, elapsed={}ms", jobId, elapsed.toMillis());
    }
    return new InferenceResult(exitCode, errors, elapsed);
  }

  /** Kills the process and waits for it to exit so the GPU is free before the next job starts. */
  private void kill(Process process, String jobId) throws InterruptedException {
    process.destroyForcibly();
    if (!process.waitFor(KILL_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
      LOGGER.warn(
          "Inference process for job {} still alive {}ms after kill", jobId, KILL_WAIT_MILLIS);
    }
  }

  private Thread startGobbler(InputStream output, List<String> errorLines, String jobId) {
    Thread thread =
        new Thread(() -> drain(output, errorLines, jobId), "inference-output-" + jobId);
    thread.setDaemon(true);
    thread.start();
    return thread;
  }

  private void drain(InputStream output, List<String> errorLines, String jobId) {
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(output, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        LOGGER.info("[inference {}] {}", jobId, line);
        if (isErrorLine(line) && errorLines.size() < MAX_ERROR_LINES) {
          errorLines.add(line.trim());
        }
      }
    } catch (IOException e) {
      LOGGER.debug("Inference output reader for job {} stopped: {}", jobId, e.toString());
    }
  }

  boolean isErrorLine(String line) {
    String lower = line.toLowerCase(Locale.ROOT);
    for (String marker : errorMarkers) {
      if (lower.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}
