package com.scholary.songgen.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.songgen.job.JobRecord;
import com.scholary.songgen.job.JobStatus;
import com.scholary.songgen.service.JobView;
import com.scholary.songgen.service.ManifestEntry;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response for {@code GET /status/{id}} and {@code GET /result/{id}}.
 *
 * <p>Queue fields are only present while the job waits; {@code outputs} and {@code downloadUrl}
 * only once it is complete; {@code error} only when it failed. {@code genresInferred} and {@code
 * rejectedGenres} describe how a requested genre list was resolved and are absent until it is.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
    String requestId,
    JobStatus status,
    Instant submittedAt,
    Instant startedAt,
    Instant completedAt,
    Integer queuePosition,
    Long estimatedWaitSeconds,
    String genre,
    List<String> genres,
    Boolean genresInferred,
    List<String> rejectedGenres,
    String lyrics,
    String lyricsProvider,
    Map<String, ManifestEntry> outputs,
    String downloadUrl,
    String error) {

  static JobStatusResponse from(JobView view, Map<String, ManifestEntry> outputs) {
    JobRecord job = view.job();
    boolean complete = job.status() == JobStatus.COMPLETE;
    String genre =
        job.resolvedGenre() != null ? job.resolvedGenre() : job.input().genre();
    boolean genresResolved = !job.resolvedGenres().isEmpty();
    return new JobStatusResponse(
        job.id(),
        job.status(),
        job.submittedAt(),
        job.startedAt(),
        job.completedAt(),
        view.queuePosition(),
        view.estimatedWaitSeconds(),
        genre,
        genresResolved ? job.resolvedGenres() : null,
        genresResolved ? job.genresInferred() : null,
        genresResolved && !job.rejectedGenres().isEmpty() ? job.rejectedGenres() : null,
        job.effectiveLyrics(),
        job.lyricsProvider(),
        complete ? outputs : null,
        complete && !outputs.isEmpty() ? "/download/" + job.id() : null,
        job.error());
  }
}
