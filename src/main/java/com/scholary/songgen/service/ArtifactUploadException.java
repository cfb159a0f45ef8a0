package com.scholary.songgen.service;

/** Thrown when none of a job's artifacts could be uploaded. */
public class ArtifactUploadException extends RuntimeException {

  public ArtifactUploadException(String message) {
    super(message);
  }
}
