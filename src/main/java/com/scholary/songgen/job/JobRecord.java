package com.scholary.songgen.job;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a job. This is both what readers see and what gets written to the result
 * snapshot file.
 */
public record JobRecord(
    String id,
    JobStatus status,
    Instant submittedAt,
    Instant startedAt,
    Instant completedAt,
    JobInput input,
    String resolvedGenre,
    List<String> resolvedGenres,
    boolean genresInferred,
    List<String> rejectedGenres,
    String generatedLyrics,
    String lyricsProvider,
    String outputDirectory,
    Map<String, ArtifactLocation> outputManifest,
    String error) {

  public JobRecord {
    resolvedGenres = resolvedGenres == null ? List.of() : List.copyOf(resolvedGenres);
    rejectedGenres = rejectedGenres == null ? List.of() : List.copyOf(rejectedGenres);
    outputManifest =
        outputManifest == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(outputManifest));
  }

  /** Lyrics the audio was (or will be) rendered from: client-supplied first, then generated. */
  public String effectiveLyrics() {
    if (input != null && input.hasLyrics()) {
      return input.lyrics();
    }
    return generatedLyrics;
  }
}
