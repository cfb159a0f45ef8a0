package com.scholary.songgen.service;

/** Thrown when a requested artifact does not exist or is no longer reachable. */
public class ArtifactNotFoundException extends RuntimeException {

  public ArtifactNotFoundException(String message) {
    super(message);
  }
}
