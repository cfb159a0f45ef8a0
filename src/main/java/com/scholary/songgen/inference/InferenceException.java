package com.scholary.songgen.inference;

/** Thrown when the inference subprocess cannot be run or does not produce audio. */
public class InferenceException extends RuntimeException {

  public InferenceException(String message) {
    super(message);
  }

  public InferenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
