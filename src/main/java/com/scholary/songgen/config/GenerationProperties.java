package com.scholary.songgen.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for job handling.
 *
 * <p>Maps the "generation.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "generation")
@Validated
public record GenerationProperties(
    @NotBlank String outputDir,
    @NotBlank String resultsFile,
    @NotNull Duration perJobEstimate,
    boolean formatLyrics,
    @Valid @NotNull GenreProperties genres,
    @Valid @NotNull OutputProperties output,
    @Valid @NotNull PromptProperties prompts) {

  public record GenreProperties(@NotBlank String vocabulary, @NotBlank String fallback) {}

  /**
   * @param audioExtensions file extensions counted as audio, without the dot
   * @param nestedDir second place to look for audio, relative to the job's output directory
   */
  public record OutputProperties(
      @NotEmpty List<String> audioExtensions, @NotBlank String nestedDir) {}

  public record PromptProperties(@NotBlank String lyricsFile, @NotBlank String genreFile) {}
}
