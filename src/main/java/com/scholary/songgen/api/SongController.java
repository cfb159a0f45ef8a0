package com.scholary.songgen.api;

import com.scholary.songgen.lyrics.LyricsProvider;
import com.scholary.songgen.lyrics.PromptStore;
import com.scholary.songgen.service.ArtifactDownload;
import com.scholary.songgen.service.ArtifactService;
import com.scholary.songgen.service.GenerationOrchestrator;
import com.scholary.songgen.service.JobView;
import com.scholary.songgen.service.LyricsResult;
import com.scholary.songgen.service.RecoveryScanner;
import com.scholary.songgen.service.RepairResult;
import com.scholary.songgen.service.SubmissionResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP API for song generation.
 *
 * <p>Generation is asynchronous: {@code POST /generate} returns a request id at once and clients
 * poll {@code /status/{id}} until the job is complete or failed, then fetch artifacts from {@code
 * /download/{id}}.
 */
@RestController
@Tag(name = "Song generation", description = "Queued lyrics and audio generation")
public class SongController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SongController.class);

  private final GenerationOrchestrator orchestrator;
  private final ArtifactService artifactService;
  private final RecoveryScanner recoveryScanner;
  private final PromptStore promptStore;

  public SongController(
      GenerationOrchestrator orchestrator,
      ArtifactService artifactService,
      RecoveryScanner recoveryScanner,
      PromptStore promptStore) {
    this.orchestrator = orchestrator;
    this.artifactService = artifactService;
    this.recoveryScanner = recoveryScanner;
    this.promptStore = promptStore;
  }

  @PostMapping("/generate")
  @Operation(
      summary = "Queue a song",
      description = "Queue a generation job and return its request id and queue position")
  public ResponseEntity<SubmissionResponse> generate(
      @Valid @RequestBody GenerationRequest request) {
    SubmissionResult result = orchestrator.submit(request.toJobInput());
    LOGGER.info(
        "Queued generation request {} at position {}", result.jobId(), result.queuePosition());
    return ResponseEntity.ok(SubmissionResponse.from(result));
  }

  @GetMapping({"/status/{id}", "/result/{id}"})
  @Operation(summary = "Get job status", description = "Current status, queue position and outputs")
  public ResponseEntity<JobStatusResponse> status(@PathVariable String id) {
    return ResponseEntity.ok(toResponse(orchestrator.status(id)));
  }

  @GetMapping("/download/{id}")
  @Operation(
      summary = "Download an artifact",
      description = "Stream audio (default), lyrics or genre of a complete job")
  public ResponseEntity<Resource> download(
      @PathVariable String id, @RequestParam(required = false) String type) {
    ArtifactDownload artifact = artifactService.resolve(id, type);
    return ResponseEntity.ok()
        .contentType(artifact.contentType())
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(artifact.fileName()).build().toString())
        .body(artifact.resource());
  }

  @PostMapping("/repair/{id}")
  @Operation(
      summary = "Repair job outputs",
      description = "Rediscover the artifacts of a complete job from its output directory")
  public ResponseEntity<RepairResponse> repair(@PathVariable String id) {
    RepairResult result = recoveryScanner.repair(id);
    RepairResponse body =
        new RepairResponse(
            id,
            result.repaired(),
            result.message(),
            toResponse(new JobView(result.job(), null, null)));
    return result.repaired()
        ? ResponseEntity.ok(body)
        : ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
  }

  @PostMapping("/generate_lyrics")
  @Operation(
      summary = "Generate lyrics",
      description = "Write lyrics and suggest a genre right away, without queueing audio")
  public ResponseEntity<LyricsResponse> generateLyrics(@Valid @RequestBody LyricsRequest request) {
    LyricsResult result = orchestrator.generateLyrics(request.prompt());
    return ResponseEntity.ok(
        new LyricsResponse(result.lyrics(), result.suggestedGenre(), result.provider()));
  }

  @GetMapping("/provider")
  @Operation(summary = "Get lyrics provider")
  public ResponseEntity<ProviderResponse> provider() {
    Optional<LyricsProvider> active = orchestrator.activeProvider();
    return ResponseEntity.ok(
        new ProviderResponse(
            active.map(LyricsProvider::name).orElse(null),
            active.map(LyricsProvider::model).orElse(null),
            availableProviders()));
  }

  @PostMapping("/provider")
  @Operation(summary = "Switch lyrics provider", description = "Takes effect for the next job")
  public ResponseEntity<ProviderResponse> switchProvider(
      @Valid @RequestBody ProviderSwitchRequest request) {
    LyricsProvider provider = orchestrator.switchProvider(request.provider());
    return ResponseEntity.ok(
        new ProviderResponse(provider.name(), provider.model(), availableProviders()));
  }

  @GetMapping("/system_prompt")
  @Operation(summary = "Get the lyrics system prompt")
  public ResponseEntity<PromptResponse> lyricsPrompt() {
    return ResponseEntity.ok(new PromptResponse(promptStore.lyricsPrompt()));
  }

  @PutMapping("/system_prompt")
  @Operation(summary = "Replace the lyrics system prompt")
  public ResponseEntity<PromptResponse> updateLyricsPrompt(
      @Valid @RequestBody PromptRequest request) {
    promptStore.updateLyricsPrompt(request.prompt());
    return ResponseEntity.ok(new PromptResponse(promptStore.lyricsPrompt()));
  }

  @GetMapping("/genre_prompt")
  @Operation(summary = "Get the genre extraction prompt")
  public ResponseEntity<PromptResponse> genrePrompt() {
    return ResponseEntity.ok(new PromptResponse(promptStore.genrePrompt()));
  }

  @PutMapping("/genre_prompt")
  @Operation(summary = "Replace the genre extraction prompt")
  public ResponseEntity<PromptResponse> updateGenrePrompt(
      @Valid @RequestBody PromptRequest request) {
    promptStore.updateGenrePrompt(request.prompt());
    return ResponseEntity.ok(new PromptResponse(promptStore.genrePrompt()));
  }

  private JobStatusResponse toResponse(JobView view) {
    return JobStatusResponse.from(view, artifactService.describe(view.job()));
  }

  private Set<String> availableProviders() {
    return orchestrator.availableProviders();
  }
}
