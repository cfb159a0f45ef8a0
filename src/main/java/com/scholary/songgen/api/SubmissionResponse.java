package com.scholary.songgen.api;

import com.scholary.songgen.job.JobStatus;
import com.scholary.songgen.service.SubmissionResult;

/** Response for {@code POST /generate}. */
public record SubmissionResponse(
    String requestId, JobStatus status, int queuePosition, long estimatedWaitSeconds) {

  static SubmissionResponse from(SubmissionResult result) {
    return new SubmissionResponse(
        result.jobId(), result.status(), result.queuePosition(), result.estimatedWaitSeconds());
  }
}
