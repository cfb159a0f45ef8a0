package com.scholary.songgen.output;

/** Manifest keys and fixed file names used for a job's artifacts. */
public final class ArtifactNames {

  public static final String AUDIO = "audio";
  public static final String LYRICS = "lyrics";
  public static final String GENRE = "genre";
  public static final String MARKER = "marker";

  public static final String LYRICS_FILE = "lyrics.txt";
  public static final String GENRE_FILE = "genre.txt";
  public static final String MARKER_FILE = "done.txt";

  private ArtifactNames() {}
}
