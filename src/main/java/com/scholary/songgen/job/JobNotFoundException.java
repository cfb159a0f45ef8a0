package com.scholary.songgen.job;

/** Thrown when a job id is not known to the repository. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
  }
}
