package com.scholary.songgen.inference;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the audio inference subprocess.
 *
 * <p>The command is {@code executable script --genre_txt ... --lyrics_txt ... --output_dir ...}
 * followed by model and tuning arguments. {@code errorMarkers} are matched case-insensitively
 * against every output line; a hit fails the run even when the exit code is 0.
 */
@ConfigurationProperties(prefix = "inference")
@Validated
public record InferenceProperties(
    @NotBlank String executable,
    @NotBlank String script,
    @NotBlank String workingDir,
    @NotBlank String stage1Model,
    @NotBlank String stage2Model,
    boolean stage1UseExl2,
    boolean stage2UseExl2,
    @NotNull Duration timeout,
    @Valid @NotNull Defaults defaults,
    List<String> extraArgs,
    List<String> errorMarkers) {

  public InferenceProperties {
    extraArgs = extraArgs == null ? List.of() : List.copyOf(extraArgs);
    errorMarkers = errorMarkers == null ? List.of() : List.copyOf(errorMarkers);
  }

  public record Defaults(
      @Positive int stage2BatchSize,
      @Positive int runNSegments,
      @Positive int maxNewTokens,
      @Positive double repetitionPenalty,
      @Positive int stage2CacheSize) {}
}
