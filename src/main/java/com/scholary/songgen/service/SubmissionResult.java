package com.scholary.songgen.service;

import com.scholary.songgen.job.JobStatus;

/** What a caller learns right after submitting. */
public record SubmissionResult(
    String jobId, JobStatus status, int queuePosition, long estimatedWaitSeconds) {}
