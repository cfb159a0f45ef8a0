package com.scholary.songgen.lyrics;

import java.util.Set;

/** Thrown when switching to a backend that does not exist or has no API key. */
public class UnknownProviderException extends IllegalArgumentException {

  public UnknownProviderException(String name, Set<String> available) {
    super("Lyrics provider '" + name + "' is not available. Available providers: " + available);
  }
}
