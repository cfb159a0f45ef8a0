package com.scholary.songgen.objectstore;

/** Thrown when a bucket operation fails. Callers decide whether the failure is fatal. */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
