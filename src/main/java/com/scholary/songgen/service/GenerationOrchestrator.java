package com.scholary.songgen.service;

import com.scholary.songgen.config.GenerationProperties;
import com.scholary.songgen.genre.GenreMatcher;
import com.scholary.songgen.inference.InferenceCommandBuilder;
import com.scholary.songgen.inference.InferenceException;
import com.scholary.songgen.inference.InferenceResult;
import com.scholary.songgen.inference.InferenceRunner;
import com.scholary.songgen.job.ArtifactLocation;
import com.scholary.songgen.job.GenerationJob;
import com.scholary.songgen.job.JobInput;
import com.scholary.songgen.job.JobNotFoundException;
import com.scholary.songgen.job.JobQueue;
import com.scholary.songgen.job.JobRecord;
import com.scholary.songgen.job.JobRepository;
import com.scholary.songgen.job.JobStatus;
import com.scholary.songgen.logging.StructuredLogger;
import com.scholary.songgen.lyrics.LyricsFormatter;
import com.scholary.songgen.lyrics.LyricsProvider;
import com.scholary.songgen.lyrics.LyricsProviderException;
import com.scholary.songgen.lyrics.LyricsProviderRegistry;
import com.scholary.songgen.lyrics.PromptStore;
import com.scholary.songgen.objectstore.ArtifactUploader;
import com.scholary.songgen.output.ArtifactNames;
import com.scholary.songgen.output.OutputLocator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Accepts generation requests and drives each job through its pipeline.
 *
 * <p>Pipeline stages for one job:
 *
 * <ol>
 *   <li>resolve a requested genre list against the vocabulary, inferring one if nothing matched
 *   <li>write lyrics with the active lyrics provider when none were supplied, and ask it for a
 *       genre when none was given
 *   <li>write the genre and lyrics files and run audio inference
 *   <li>upload lyrics, genre and the primary audio file, or keep them local when no object store
 *       is configured
 * </ol>
 *
 * <p>Any failure moves the job to ERROR with a message; nothing is retried. {@link #process} is
 * only ever called from the single {@link JobWorker} thread.
 */
@Service
public class GenerationOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(GenerationOrchestrator.class);

  private static final String DEFAULT_SONG_FILE_NAME = "song";

  private final JobRepository repository;
  private final JobQueue jobQueue;
  private final GenreMatcher genreMatcher;
  private final LyricsProviderRegistry lyricsProviders;
  private final PromptStore promptStore;
  private final LyricsFormatter lyricsFormatter;
  private final InferenceCommandBuilder commandBuilder;
  private final InferenceRunner inferenceRunner;
  private final OutputLocator outputLocator;
  private final Optional<ArtifactUploader> artifactUploader;
  private final GenerationProperties properties;
  private final Clock clock;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public GenerationOrchestrator(
      JobRepository repository,
      JobQueue jobQueue,
      GenreMatcher genreMatcher,
      LyricsProviderRegistry lyricsProviders,
      PromptStore promptStore,
      LyricsFormatter lyricsFormatter,
      InferenceCommandBuilder commandBuilder,
      InferenceRunner inferenceRunner,
      OutputLocator outputLocator,
      Optional<ArtifactUploader> artifactUploader,
      GenerationProperties properties,
      Clock clock) {
    this.repository = repository;
    this.jobQueue = jobQueue;
    this.genreMatcher = genreMatcher;
    this.lyricsProviders = lyricsProviders;
    this.promptStore = promptStore;
    this.lyricsFormatter = lyricsFormatter;
    this.commandBuilder = commandBuilder;
    this.inferenceRunner = inferenceRunner;
    this.outputLocator = outputLocator;
    this.artifactUploader = artifactUploader;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Records a new job and queues it.
   *
   * @throws InvalidSubmissionException if the input has neither a prompt nor both genre and
   *     lyrics
   */
  public SubmissionResult submit(JobInput input) {
    validate(input);

    String jobId = UUID.randomUUID().toString();
    int position =
        repository.insert(
            new GenerationJob(jobId, input, clock.instant()), record -> jobQueue.enqueue(jobId));
    structuredLogger.logJobSubmitted(jobId, position, !input.hasLyrics());

    return new SubmissionResult(jobId, JobStatus.QUEUED, position, estimateWaitSeconds(position));
  }

  /**
   * @throws JobNotFoundException if the id is unknown
   */
  public JobView status(String jobId) {
    JobRecord job = repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    if (job.status() != JobStatus.QUEUED) {
      return new JobView(job, null, null);
    }
    OptionalInt position = jobQueue.position(jobId);
    if (position.isEmpty()) {
      return new JobView(job, null, null);
    }
    int ahead = position.getAsInt();
    return new JobView(job, ahead, estimateWaitSeconds(ahead));
  }

  /** Runs one dequeued job to COMPLETE or ERROR. */
  public void process(String jobId) {
    StructuredLogger.setJobContext(jobId);
    try {
      try {
        JobRecord job = transition(jobId, JobStatus.PROCESSING, ignored -> {});
        runPipeline(job);
      } catch (IOException | RuntimeException e) {
        fail(jobId, e);
      }
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  /**
   * Writes lyrics for {@code prompt} right away, outside the job queue.
   *
   * @throws LyricsProviderException if no provider is configured or the lyrics call fails
   */
  public LyricsResult generateLyrics(String prompt) {
    LyricsProvider provider = lyricsProviders.requireActive();
    String lyrics = provider.generateLyrics(prompt, promptStore.lyricsPrompt());
    String genre = null;
    try {
      genre = genreMatcher.match(provider.extractGenre(prompt, promptStore.genrePrompt()));
    } catch (LyricsProviderException e) {
      LOGGER.warn("Genre suggestion failed, returning lyrics only: {}", e.getMessage());
    }
    return new LyricsResult(lyrics, genre, provider.name());
  }

  public Optional<LyricsProvider> activeProvider() {
    return lyricsProviders.active();
  }

  public LyricsProvider switchProvider(String name) {
    return lyricsProviders.switchTo(name);
  }

  public Set<String> availableProviders() {
    return lyricsProviders.available();
  }

  private void runPipeline(JobRecord job) throws IOException {
    String jobId = job.id();
    JobInput input = job.input();

    List<String> genres = input.hasGenres() ? resolveGenres(jobId, input) : List.of();
    String genre = input.hasGenre() ? input.genre() : genres.isEmpty() ? null : genres.get(0);
    String lyrics = input.lyrics();

    if (!input.hasLyrics()) {
      transition(jobId, JobStatus.GENERATING_LYRICS, ignored -> {});
      LyricsProvider provider = lyricsProviders.requireActive();
      String generated =
          genres.isEmpty()
              ? provider.generateLyrics(input.prompt(), promptStore.lyricsPrompt())
              : provider.generateLyricsWithGenres(input.prompt(), genres);
      if (genre == null) {
        genre = provider.extractGenre(input.prompt(), promptStore.genrePrompt());
      }
      repository.update(
          jobId,
          j -> {
            j.setGeneratedLyrics(generated);
            j.setLyricsProvider(provider.name());
          });
      lyrics = generated;
    } else if (genre == null) {
      LyricsProvider provider = lyricsProviders.requireActive();
      genre = provider.extractGenre(input.prompt(), promptStore.genrePrompt());
      repository.update(jobId, j -> j.setLyricsProvider(provider.name()));
    }

    RenderedSong song = renderAudio(jobId, input, genre, lyrics);
    publish(jobId, input, song);
  }

  private List<String> resolveGenres(String jobId, JobInput input) {
    List<String> recognized = new ArrayList<>();
    List<String> rejected = new ArrayList<>();
    for (String requested : input.genres()) {
      if (genreMatcher.isRecognized(requested)) {
        recognized.add(requested);
      } else {
        rejected.add(requested);
      }
    }
    boolean inferred = recognized.isEmpty();
    List<String> resolved =
        inferred ? inferGenres(jobId, input.prompt()) : genreMatcher.matchMany(recognized);
    repository.update(jobId, j -> j.setGenreResolution(resolved, inferred, rejected));
    if (!rejected.isEmpty()) {
      LOGGER.warn("Job {} requested unrecognized genres {}", jobId, rejected);
    }
    LOGGER.info(
        "Resolved genres for job {}: requested={}, used={}, inferred={}",
        jobId,
        input.genres(),
        resolved,
        inferred);
    return resolved;
  }

  private List<String> inferGenres(String jobId, String prompt) {
    Optional<LyricsProvider> provider = lyricsProviders.active();
    if (provider.isEmpty() || prompt == null || prompt.isBlank()) {
      return List.of(genreMatcher.fallback());
    }
    try {
      return genreMatcher.matchMany(provider.get().inferGenres(prompt));
    } catch (LyricsProviderException e) {
      LOGGER.warn(
          "Genre inference failed for job {}, using '{}': {}",
          jobId,
          genreMatcher.fallback(),
          e.getMessage());
      return List.of(genreMatcher.fallback());
    }
  }

  private RenderedSong renderAudio(String jobId, JobInput input, String genre, String lyrics)
      throws IOException {
    Path outputDir = Path.of(properties.outputDir()).resolve(jobId).toAbsolutePath();
    String resolvedGenre = genreMatcher.match(genre);
    transition(
        jobId,
        JobStatus.GENERATING_AUDIO,
        j -> {
          j.setOutputDirectory(outputDir.toString());
          j.setResolvedGenre(resolvedGenre);
        });

    Files.createDirectories(outputDir);
    Path genreFile = outputDir.resolve(ArtifactNames.GENRE_FILE);
    Path lyricsFile = outputDir.resolve(ArtifactNames.LYRICS_FILE);
    Files.writeString(genreFile, resolvedGenre, StandardCharsets.UTF_8);
    String lyricsText = properties.formatLyrics() ? lyricsFormatter.format(lyrics) : lyrics;
    Files.writeString(lyricsFile, lyricsText, StandardCharsets.UTF_8);

    List<String> command = commandBuilder.build(genreFile, lyricsFile, outputDir, input.tuning());
    InferenceResult result = inferenceRunner.run(command, jobId);
    structuredLogger.logInferenceFinished(
        jobId, result.exitCode(), result.elapsed().toMillis(), result.errorLines().size());
    if (!result.isSuccess()) {
      throw new InferenceException(result.describeFailure());
    }

    List<Path> audio = outputLocator.findAudioArtifacts(outputDir);
    if (audio.isEmpty()) {
      throw new InferenceException("Inference finished but produced no audio in " + outputDir);
    }
    return new RenderedSong(genreFile, lyricsFile, outputLocator.selectPrimary(audio));
  }

  private void publish(String jobId, JobInput input, RenderedSong song) {
    transition(jobId, JobStatus.UPLOADING, ignored -> {});

    Map<String, Path> artifacts = new LinkedHashMap<>();
    artifacts.put(ArtifactNames.LYRICS, song.lyricsFile());
    artifacts.put(ArtifactNames.GENRE, song.genreFile());
    artifacts.put(ArtifactNames.AUDIO, song.audio());

    Map<String, ArtifactLocation> manifest = new LinkedHashMap<>();
    if (artifactUploader.isPresent()) {
      upload(jobId, input, artifacts, artifactUploader.get(), manifest);
    } else {
      artifacts.forEach((name, path) -> manifest.put(name, ArtifactLocation.local(path)));
      LOGGER.info("Object store disabled, keeping artifacts of job {} on local disk", jobId);
    }

    repository.update(
        jobId,
        job -> {
          job.complete(manifest, clock.instant());
          structuredLogger.logJobTransition(
              jobId, JobStatus.UPLOADING.value(), JobStatus.COMPLETE.value());
        });
  }

  private void upload(
      String jobId,
      JobInput input,
      Map<String, Path> artifacts,
      ArtifactUploader uploader,
      Map<String, ArtifactLocation> manifest) {
    String folder = remoteFolder(jobId, input);
    List<String> failed = new ArrayList<>();

    for (Map.Entry<String, Path> artifact : artifacts.entrySet()) {
      String name = artifact.getKey();
      Path path = artifact.getValue();
      String remoteKey = folder + "/" + remoteFileName(name, path, input);
      if (uploader.upload(path, remoteKey)) {
        manifest.put(name, ArtifactLocation.uploaded(path, remoteKey));
      } else {
        structuredLogger.logArtifactUploadFailed(jobId, name, remoteKey);
        manifest.put(name, ArtifactLocation.local(path));
        failed.add(name);
      }
    }

    if (failed.size() == artifacts.size()) {
      throw new ArtifactUploadException(
          "All " + artifacts.size() + " artifact uploads failed for job " + jobId);
    }
    if (failed.isEmpty()) {
      Path outputDir = artifacts.get(ArtifactNames.LYRICS).getParent();
      uploadCompletionMarker(jobId, folder, outputDir, uploader, manifest);
    }
  }

  private void uploadCompletionMarker(
      String jobId,
      String folder,
      Path outputDir,
      ArtifactUploader uploader,
      Map<String, ArtifactLocation> manifest) {
    Path marker = outputDir.resolve(ArtifactNames.MARKER_FILE);
    String remoteKey = folder + "/" + ArtifactNames.MARKER_FILE;
    try {
      Files.writeString(
          marker, "Upload completed at " + clock.instant() + "\n", StandardCharsets.UTF_8);
    } catch (IOException e) {
      LOGGER.warn("Could not write completion marker for job {}: {}", jobId, e.getMessage());
      return;
    }
    if (uploader.upload(marker, remoteKey)) {
      manifest.put(ArtifactNames.MARKER, ArtifactLocation.uploaded(marker, remoteKey));
    } else {
      structuredLogger.logArtifactUploadFailed(jobId, ArtifactNames.MARKER, remoteKey);
    }
  }

  private JobRecord transition(String jobId, JobStatus next, Consumer<GenerationJob> changes) {
    return repository.update(
        jobId,
        job -> {
          JobStatus from = job.getStatus();
          job.transitionTo(next, clock.instant());
          changes.accept(job);
          structuredLogger.logJobTransition(jobId, from.value(), next.value());
        });
  }

  private void fail(String jobId, Exception e) {
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    structuredLogger.logJobFailed(jobId, e.getClass().getSimpleName(), message);
    LOGGER.debug("Failure detail for job {}", jobId, e);
    repository.update(
        jobId,
        job -> {
          if (!job.getStatus().isTerminal()) {
            JobStatus from = job.getStatus();
            job.fail(message, clock.instant());
            structuredLogger.logJobTransition(jobId, from.value(), JobStatus.ERROR.value());
          }
        });
  }

  private void validate(JobInput input) {
    if (input == null) {
      throw new InvalidSubmissionException("Request body is required");
    }
    boolean hasGenre = input.hasGenre() || input.hasGenres();
    if (!input.hasPrompt() && !(hasGenre && input.hasLyrics())) {
      throw new InvalidSubmissionException(
          "Either a prompt, or both a genre and lyrics, must be provided");
    }
  }

  private long estimateWaitSeconds(int position) {
    return position * properties.perJobEstimate().toSeconds();
  }

  static String remoteFolder(String jobId, JobInput input) {
    List<String> parts = new ArrayList<>();
    if (input.userId() != null && !input.userId().isBlank()) {
      parts.add(input.userId().trim());
    }
    parts.add(jobId);
    if (input.songName() != null && !input.songName().isBlank()) {
      parts.add(input.songName().trim());
    }
    return sanitize(String.join("_", parts));
  }

  static String remoteFileName(String artifact, Path path, JobInput input) {
    String fileName = path.getFileName().toString();
    if (!ArtifactNames.AUDIO.equals(artifact)) {
      return fileName;
    }
    String base =
        input.songName() != null && !input.songName().isBlank()
            ? sanitize(input.songName().trim())
            : DEFAULT_SONG_FILE_NAME;
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? base + fileName.substring(dot) : base;
  }

  private static String sanitize(String value) {
    return value.replaceAll("[^A-Za-z0-9._-]", "_");
  }

  private record RenderedSong(Path genreFile, Path lyricsFile, Path audio) {}
}
