package com.scholary.songgen.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.songgen.config.GenerationProperties;
import com.scholary.songgen.job.ArtifactLocation;
import com.scholary.songgen.job.JobInput;
import com.scholary.songgen.job.JobNotFoundException;
import com.scholary.songgen.job.JobRecord;
import com.scholary.songgen.job.JobRepository;
import com.scholary.songgen.job.JobStatus;
import com.scholary.songgen.job.ResultStore;
import com.scholary.songgen.output.OutputLocator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecoveryScannerTest {

  @TempDir Path tempDir;

  private Path outputRoot;
  private ResultStore resultStore;
  private GenerationProperties properties;

  @BeforeEach
  void setUp() {
    outputRoot = tempDir.resolve("output");
    resultStore =
        new ResultStore(
            tempDir.resolve("results.json"), new ObjectMapper().findAndRegisterModules());
    properties =
        new GenerationProperties(
            outputRoot.toString(),
            tempDir.resolve("results.json").toString(),
            Duration.ofSeconds(60),
            true,
            new GenerationProperties.GenreProperties("unused", "pop"),
            new GenerationProperties.OutputProperties(List.of("wav", "mp3"), "vocoder/mix"),
            new GenerationProperties.PromptProperties("unused", "unused"));
  }

  @Test
  void recoverAll_shouldRebuildManifestOfCompleteJobs() throws IOException {
    Path dir = outputRoot.resolve("job-1");
    write(dir.resolve("vocoder/mix/small.wav"), 10);
    Path primary = write(dir.resolve("vocoder/mix/large.wav"), 100);
    write(dir.resolve("lyrics.txt"), 5);
    resultStore.save(List.of(record("job-1", JobStatus.COMPLETE, dir, Map.of())));
    JobRepository repository = new JobRepository(resultStore);

    int repaired = scanner(repository).recoverAll();

    assertThat(repaired).isEqualTo(1);
    Map<String, ArtifactLocation> manifest =
        repository.findById("job-1").orElseThrow().outputManifest();
    assertThat(manifest).containsOnlyKeys("audio", "lyrics");
    assertThat(manifest.get("audio").localPath()).isEqualTo(primary.toString());
    assertThat(resultStore.load().get("job-1").outputManifest()).containsKey("audio");
  }

  @Test
  void recoverAll_shouldLeaveOtherJobsAlone() throws IOException {
    Path errored = outputRoot.resolve("job-err");
    write(errored.resolve("song.wav"), 10);
    Path intact = outputRoot.resolve("job-ok");
    write(intact.resolve("new.wav"), 10);
    Map<String, ArtifactLocation> existing =
        Map.of("audio", ArtifactLocation.uploaded(intact.resolve("old.wav"), "job-ok/old.wav"));
    resultStore.save(
        List.of(
            record("job-err", JobStatus.ERROR, errored, Map.of()),
            record("job-ok", JobStatus.COMPLETE, intact, existing),
            record("job-empty", JobStatus.COMPLETE, outputRoot.resolve("job-empty"), Map.of())));
    JobRepository repository = new JobRepository(resultStore);

    int repaired = scanner(repository).recoverAll();

    assertThat(repaired).isZero();
    assertThat(repository.findById("job-err").orElseThrow().outputManifest()).isEmpty();
    assertThat(repository.findById("job-ok").orElseThrow().outputManifest()).isEqualTo(existing);
    assertThat(repository.findById("job-empty").orElseThrow().outputManifest()).isEmpty();
  }

  @Test
  void repair_shouldFallBackToDefaultOutputDirectory() throws IOException {
    write(outputRoot.resolve("job-1/song.mp3"), 10);
    resultStore.save(List.of(record("job-1", JobStatus.COMPLETE, null, Map.of())));
    RecoveryScanner scanner = scanner(new JobRepository(resultStore));

    RepairResult result = scanner.repair("job-1");

    assertThat(result.repaired()).isTrue();
    assertThat(result.job().outputManifest()).containsKey("audio");
  }

  @Test
  void repair_shouldRefuseJobsThatAreNotComplete() {
    resultStore.save(List.of(record("job-1", JobStatus.QUEUED, null, Map.of())));
    RecoveryScanner scanner = scanner(new JobRepository(resultStore));

    RepairResult result = scanner.repair("job-1");

    assertThat(result.repaired()).isFalse();
    assertThat(result.message()).contains("only complete jobs");
  }

  @Test
  void repair_shouldReportMissingAudio() {
    resultStore.save(
        List.of(record("job-1", JobStatus.COMPLETE, outputRoot.resolve("job-1"), Map.of())));
    RecoveryScanner scanner = scanner(new JobRepository(resultStore));

    RepairResult result = scanner.repair("job-1");

    assertThat(result.repaired()).isFalse();
    assertThat(result.message()).startsWith("no audio found");
  }

  @Test
  void repair_shouldRejectUnknownJob() {
    RecoveryScanner scanner = scanner(new JobRepository(resultStore));

    assertThatThrownBy(() -> scanner.repair("missing"))
        .isInstanceOf(JobNotFoundException.class);
  }

  private RecoveryScanner scanner(JobRepository repository) {
    return new RecoveryScanner(repository, new OutputLocator(properties), properties);
  }

  private static JobRecord record(
      String id, JobStatus status, Path outputDir, Map<String, ArtifactLocation> manifest) {
    return new JobRecord(
        id,
        status,
        Instant.EPOCH,
        Instant.EPOCH,
        status.isTerminal() ? Instant.EPOCH : null,
        JobInput.of(null, "rock", "la la"),
        "rock",
        List.of(),
        false,
        List.of(),
        null,
        null,
        outputDir == null ? null : outputDir.toString(),
        manifest,
        status == JobStatus.ERROR ? "boom" : null);
  }

  private static Path write(Path file, int bytes) throws IOException {
    Files.createDirectories(file.getParent());
    return Files.write(file, new byte[bytes]);
  }
}
