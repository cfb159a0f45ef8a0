package com.scholary.songgen.lyrics;

/** Thrown when no lyrics backend is available or a backend call fails after retries. */
public class LyricsProviderException extends RuntimeException {

  public LyricsProviderException(String message) {
    super(message);
  }

  public LyricsProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
