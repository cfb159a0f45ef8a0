package com.scholary.songgen.job;

/** Thrown when the job snapshot file cannot be written. */
public class ResultStoreException extends RuntimeException {

  public ResultStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
