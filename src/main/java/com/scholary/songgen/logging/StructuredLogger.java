package com.scholary.songgen.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Logs job lifecycle events with MDC fields, so the JSON log output can be filtered by event type
 * and job id.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  public void logJobSubmitted(String jobId, int queuePosition, boolean needsLyrics) {
    try {
      MDC.put("event_type", "job_submitted");
      MDC.put("queuePosition", String.valueOf(queuePosition));
      MDC.put("needsLyrics", String.valueOf(needsLyrics));

      logger.info(
          "Job submitted: jobId={}, queuePosition={}, needsLyrics={}",
          jobId,
          queuePosition,
          needsLyrics);
    } finally {
      clearEventFields();
    }
  }

  public void logJobTransition(String jobId, String from, String to) {
    try {
      MDC.put("event_type", "job_transition");
      MDC.put("fromStatus", from);
      MDC.put("toStatus", to);

      logger.info("Job transition: jobId={}, {} -> {}", jobId, from, to);
    } finally {
      clearEventFields();
    }
  }

  public void logInferenceFinished(String jobId, int exitCode, long elapsedMs, int errorLines) {
    try {
      MDC.put("event_type", "inference_finished");
      MDC.put("exitCode", String.valueOf(exitCode));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));
      MDC.put("errorLines", String.valueOf(errorLines));

      logger.info(
          "Inference finished: jobId={}, exitCode={}, elapsed={}ms, errorLines={}",
          jobId,
          exitCode,
          elapsedMs,
          errorLines);
    } finally {
      clearEventFields();
    }
  }

  public void logArtifactUploadFailed(String jobId, String artifact, String remoteKey) {
    try {
      MDC.put("event_type", "artifact_upload_failed");
      MDC.put("artifact", artifact);
      MDC.put("remoteKey", remoteKey);

      logger.warn(
          "Artifact upload failed, keeping local copy: jobId={}, artifact={}, key={}",
          jobId,
          artifact,
          remoteKey);
    } finally {
      clearEventFields();
    }
  }

  public void logJobFailed(String jobId, String errorType, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("errorType", errorType);

      logger.error("Job failed: jobId={}, error={}, message={}", jobId, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  public void logRecoveryResult(String jobId, boolean repaired, String detail) {
    try {
      MDC.put("event_type", "recovery_result");
      MDC.put("repaired", String.valueOf(repaired));

      if (repaired) {
        logger.info("Recovered job outputs: jobId={}, {}", jobId, detail);
      } else {
        logger.warn("Could not recover job outputs: jobId={}, {}", jobId, detail);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put("jobId", jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("queuePosition");
    MDC.remove("needsLyrics");
    MDC.remove("fromStatus");
    MDC.remove("toStatus");
    MDC.remove("exitCode");
    MDC.remove("elapsedMs");
    MDC.remove("errorLines");
    MDC.remove("artifact");
    MDC.remove("remoteKey");
    MDC.remove("errorType");
    MDC.remove("repaired");
  }
}
