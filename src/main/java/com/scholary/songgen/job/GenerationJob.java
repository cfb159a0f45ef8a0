package com.scholary.songgen.job;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a generation job while it is owned by {@link JobRepository}.
 *
 * <p>Status changes go through {@link #transitionTo}, {@link #complete} and {@link #fail}, which
 * reject moves the lifecycle does not allow. Callers outside the repository only ever see {@link
 * JobRecord} snapshots.
 */
public class GenerationJob {

  private final String id;
  private final JobInput input;
  private final Instant submittedAt;

  private JobStatus status;
  private Instant startedAt;
  private Instant completedAt;
  private String resolvedGenre;
  private List<String> resolvedGenres = List.of();
  private boolean genresInferred;
  private List<String> rejectedGenres = List.of();
  private String generatedLyrics;
  private String lyricsProvider;
  private String outputDirectory;
  private Map<String, ArtifactLocation> outputManifest = Map.of();
  private String error;

  public GenerationJob(String id, JobInput input, Instant submittedAt) {
    this.id = id;
    this.input = input;
    this.submittedAt = submittedAt;
    this.status = JobStatus.QUEUED;
  }

  /** Rebuilds a job from a persisted snapshot without re-validating its history. */
  public static GenerationJob restore(JobRecord record) {
    GenerationJob job = new GenerationJob(record.id(), record.input(), record.submittedAt());
    job.status = record.status();
    job.startedAt = record.startedAt();
    job.completedAt = record.completedAt();
    job.resolvedGenre = record.resolvedGenre();
    job.resolvedGenres = record.resolvedGenres();
    job.genresInferred = record.genresInferred();
    job.rejectedGenres = record.rejectedGenres();
    job.generatedLyrics = record.generatedLyrics();
    job.lyricsProvider = record.lyricsProvider();
    job.outputDirectory = record.outputDirectory();
    job.outputManifest = record.outputManifest();
    job.error = record.error();
    return job;
  }

  public JobRecord toRecord() {
    return new JobRecord(
        id,
        status,
        submittedAt,
        startedAt,
        completedAt,
        input,
        resolvedGenre,
        resolvedGenres,
        genresInferred,
        rejectedGenres,
        generatedLyrics,
        lyricsProvider,
        outputDirectory,
        outputManifest,
        error);
  }

  /**
   * @throws IllegalStateException if the lifecycle does not allow moving to {@code next}
   */
  public void transitionTo(JobStatus next, Instant at) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          String.format("Illegal transition for job %s: %s -> %s", id, status, next));
    }
    if (next == JobStatus.PROCESSING) {
      startedAt = at;
    }
    status = next;
  }

  /** Moves to COMPLETE. A complete job always carries at least one artifact. */
  public void complete(Map<String, ArtifactLocation> manifest, Instant at) {
    if (manifest == null || manifest.isEmpty()) {
      throw new IllegalArgumentException("Job " + id + " cannot complete without artifacts");
    }
    transitionTo(JobStatus.COMPLETE, at);
    outputManifest = Map.copyOf(manifest);
    completedAt = at;
  }

  public void fail(String message, Instant at) {
    transitionTo(JobStatus.ERROR, at);
    error = message == null || message.isBlank() ? "Unknown error" : message;
    completedAt = at;
  }

  /** Re-attaches rediscovered artifacts to a COMPLETE job whose manifest was lost. */
  public void restoreManifest(Map<String, ArtifactLocation> manifest) {
    if (status != JobStatus.COMPLETE) {
      throw new IllegalStateException(
          "Only complete jobs can be repaired, job " + id + " is " + status);
    }
    if (manifest == null || manifest.isEmpty()) {
      throw new IllegalArgumentException("Repaired manifest for job " + id + " is empty");
    }
    outputManifest = Map.copyOf(manifest);
  }

  public String getId() {
    return id;
  }

  public JobInput getInput() {
    return input;
  }

  public JobStatus getStatus() {
    return status;
  }

  public void setResolvedGenre(String resolvedGenre) {
    this.resolvedGenre = resolvedGenre;
  }

  /**
   * Records how a requested genre list was resolved.
   *
   * @param inferred whether the genres came from the lyrics provider because none were recognized
   * @param rejected requested genres that are not in the vocabulary
   */
  public void setGenreResolution(List<String> resolved, boolean inferred, List<String> rejected) {
    this.resolvedGenres = List.copyOf(resolved);
    this.genresInferred = inferred;
    this.rejectedGenres = List.copyOf(rejected);
  }

  public void setGeneratedLyrics(String generatedLyrics) {
    this.generatedLyrics = generatedLyrics;
  }

  public void setLyricsProvider(String lyricsProvider) {
    this.lyricsProvider = lyricsProvider;
  }

  public void setOutputDirectory(String outputDirectory) {
    this.outputDirectory = outputDirectory;
  }
}
