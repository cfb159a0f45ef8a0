package com.scholary.songgen.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GenerationJobTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
  private static final Instant T1 = Instant.parse("2024-05-01T10:05:00Z");

  private static final Map<String, ArtifactLocation> MANIFEST =
      Map.of("audio", ArtifactLocation.local(Path.of("/out/job-1/song.mp3")));

  @Test
  void newJob_shouldStartQueued() {
    GenerationJob job = new GenerationJob("job-1", JobInput.of("a song", null, null), T0);

    JobRecord record = job.toRecord();
    assertThat(record.status()).isEqualTo(JobStatus.QUEUED);
    assertThat(record.submittedAt()).isEqualTo(T0);
    assertThat(record.startedAt()).isNull();
    assertThat(record.outputManifest()).isEmpty();
  }

  @Test
  void transitionTo_shouldRecordStartTime() {
    GenerationJob job = new GenerationJob("job-1", JobInput.of("a song", null, null), T0);

    job.transitionTo(JobStatus.PROCESSING, T1);

    assertThat(job.toRecord().startedAt()).isEqualTo(T1);
  }

  @Test
  void transitionTo_shouldRejectIllegalMove() {
    GenerationJob job = new GenerationJob("job-1", JobInput.of("a song", null, null), T0);

    assertThatThrownBy(() -> job.transitionTo(JobStatus.UPLOADING, T1))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("queued -> uploading");
    assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
  }

  @Test
  void complete_shouldRequireAtLeastOneArtifact() {
    GenerationJob job = uploadingJob();

    assertThatThrownBy(() -> job.complete(Map.of(), T1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(job.getStatus()).isEqualTo(JobStatus.UPLOADING);

    job.complete(MANIFEST, T1);
    assertThat(job.toRecord().outputManifest()).containsKey("audio");
    assertThat(job.toRecord().completedAt()).isEqualTo(T1);
  }

  @Test
  void fail_shouldSubstituteMessageWhenBlank() {
    GenerationJob job = new GenerationJob("job-1", JobInput.of("a song", null, null), T0);

    job.fail("  ", T1);

    assertThat(job.toRecord().status()).isEqualTo(JobStatus.ERROR);
    assertThat(job.toRecord().error()).isEqualTo("Unknown error");
  }

  @Test
  void fail_shouldNotOverrideTerminalState() {
    GenerationJob job = uploadingJob();
    job.complete(MANIFEST, T1);

    assertThatThrownBy(() -> job.fail("late failure", T1))
        .isInstanceOf(IllegalStateException.class);
    assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETE);
  }

  @Test
  void restoreManifest_shouldOnlyApplyToCompleteJobs() {
    GenerationJob queued = new GenerationJob("job-1", JobInput.of("a song", null, null), T0);

    assertThatThrownBy(() -> queued.restoreManifest(MANIFEST))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void restore_shouldRebuildFromRecord() {
    GenerationJob job = uploadingJob();
    job.setResolvedGenre("rock");
    job.complete(MANIFEST, T1);

    GenerationJob restored = GenerationJob.restore(job.toRecord());

    assertThat(restored.toRecord()).isEqualTo(job.toRecord());
  }

  private static GenerationJob uploadingJob() {
    GenerationJob job = new GenerationJob("job-1", JobInput.of(null, "rock", "la la"), T0);
    job.transitionTo(JobStatus.PROCESSING, T0);
    job.transitionTo(JobStatus.GENERATING_AUDIO, T0);
    job.transitionTo(JobStatus.UPLOADING, T0);
    return job;
  }
}
