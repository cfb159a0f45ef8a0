package com.scholary.songgen.service;

import com.scholary.songgen.config.GenerationProperties;
import com.scholary.songgen.job.ArtifactLocation;
import com.scholary.songgen.job.JobNotFoundException;
import com.scholary.songgen.job.JobRecord;
import com.scholary.songgen.job.JobRepository;
import com.scholary.songgen.job.JobStatus;
import com.scholary.songgen.logging.StructuredLogger;
import com.scholary.songgen.output.ArtifactNames;
import com.scholary.songgen.output.OutputLocator;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Re-attaches local artifacts to COMPLETE jobs that lost their manifest, e.g. when the process died
 * between writing audio and persisting the final snapshot.
 *
 * <p>Runs once on startup and on demand for a single job. Jobs in any other status are left alone.
 */
@Component
public class RecoveryScanner implements ApplicationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecoveryScanner.class);

  private final JobRepository repository;
  private final OutputLocator outputLocator;
  private final Path outputRoot;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public RecoveryScanner(
      JobRepository repository, OutputLocator outputLocator, GenerationProperties properties) {
    this.repository = repository;
    this.outputLocator = outputLocator;
    this.outputRoot = Path.of(properties.outputDir());
  }

  @Override
  public void run(ApplicationArguments args) {
    recoverAll();
  }

  /** Repairs every COMPLETE job whose manifest is empty. Returns the number repaired. */
  public int recoverAll() {
    int repaired = 0;
    int failed = 0;
    for (JobRecord job : repository.findAll()) {
      if (job.status() != JobStatus.COMPLETE || !job.outputManifest().isEmpty()) {
        continue;
      }
      if (rebuild(job).repaired()) {
        repaired++;
      } else {
        failed++;
      }
    }
    if (repaired + failed > 0) {
      LOGGER.info("Recovery complete: {} repaired, {} failed", repaired, failed);
    }
    return repaired;
  }

  /**
   * Rediscovers the artifacts of one COMPLETE job, replacing its manifest.
   *
   * @throws JobNotFoundException if the id is unknown
   */
  public RepairResult repair(String jobId) {
    JobRecord job = repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    if (job.status() != JobStatus.COMPLETE) {
      return new RepairResult(
          false, "Job is " + job.status() + ", only complete jobs can be repaired", job);
    }
    return rebuild(job);
  }

  private RepairResult rebuild(JobRecord job) {
    Path outputDir =
        job.outputDirectory() != null
            ? Path.of(job.outputDirectory())
            : outputRoot.resolve(job.id());

    List<Path> audio;
    try {
      audio = outputLocator.findAudioArtifacts(outputDir);
    } catch (UncheckedIOException e) {
      String detail = "cannot read " + outputDir + ": " + e.getMessage();
      structuredLogger.logRecoveryResult(job.id(), false, detail);
      return new RepairResult(false, detail, job);
    }
    if (audio.isEmpty()) {
      String detail = "no audio found in " + outputDir;
      structuredLogger.logRecoveryResult(job.id(), false, detail);
      return new RepairResult(false, detail, job);
    }

    Map<String, ArtifactLocation> manifest = new LinkedHashMap<>();
    manifest.put(ArtifactNames.AUDIO, ArtifactLocation.local(outputLocator.selectPrimary(audio)));
    addIfPresent(manifest, ArtifactNames.LYRICS, outputDir.resolve(ArtifactNames.LYRICS_FILE));
    addIfPresent(manifest, ArtifactNames.GENRE, outputDir.resolve(ArtifactNames.GENRE_FILE));

    JobRecord updated = repository.update(job.id(), j -> j.restoreManifest(manifest));
    String detail = "restored " + manifest.keySet() + " from " + outputDir;
    structuredLogger.logRecoveryResult(job.id(), true, detail);
    return new RepairResult(true, detail, updated);
  }

  private static void addIfPresent(Map<String, ArtifactLocation> manifest, String name, Path file) {
    if (Files.isRegularFile(file)) {
      manifest.put(name, ArtifactLocation.local(file));
    }
  }
}
