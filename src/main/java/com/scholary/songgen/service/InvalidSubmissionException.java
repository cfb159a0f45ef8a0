package com.scholary.songgen.service;

/** Thrown when a submission cannot become a job. */
public class InvalidSubmissionException extends RuntimeException {

  public InvalidSubmissionException(String message) {
    super(message);
  }
}
