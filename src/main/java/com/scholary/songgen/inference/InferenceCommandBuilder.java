package com.scholary.songgen.inference;

import com.scholary.songgen.job.InferenceTuning;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Builds the inference command line from configuration and per-job overrides. */
@Component
public class InferenceCommandBuilder {

  private final InferenceProperties properties;

  public InferenceCommandBuilder(InferenceProperties properties) {
    this.properties = properties;
  }

  public List<String> build(
      Path genreFile, Path lyricsFile, Path outputDir, InferenceTuning tuning) {
    InferenceTuning overrides = tuning == null ? InferenceTuning.DEFAULTS : tuning;
    InferenceProperties.Defaults defaults = properties.defaults();

    List<String> command = new ArrayList<>();
    command.add(properties.executable());
    command.add(properties.script());
    add(command, "--genre_txt", genreFile.toString());
    add(command, "--lyrics_txt", lyricsFile.toString());
    add(command, "--output_dir", outputDir.toString());
    add(command, "--stage1_model", firstNonNull(overrides.stage1Model(), properties.stage1Model()));
    add(command, "--stage2_model", firstNonNull(overrides.stage2Model(), properties.stage2Model()));
    if (properties.stage1UseExl2()) {
      command.add("--stage1_use_exl2");
    }
    if (properties.stage2UseExl2()) {
      command.add("--stage2_use_exl2");
    }

    add(
        command,
        "--stage2_batch_size",
        firstNonNull(overrides.stage2BatchSize(), defaults.stage2BatchSize()));
    add(
        command,
        "--run_n_segments",
        firstNonNull(overrides.runNSegments(), defaults.runNSegments()));
    add(
        command,
        "--max_new_tokens",
        firstNonNull(overrides.maxNewTokens(), defaults.maxNewTokens()));
    add(
        command,
        "--repetition_penalty",
        firstNonNull(overrides.repetitionPenalty(), defaults.repetitionPenalty()));
    add(
        command,
        "--stage2_cache_size",
        firstNonNull(overrides.stage2CacheSize(), defaults.stage2CacheSize()));

    if (overrides.cudaIdx() != null) {
      add(command, "--cuda_idx", overrides.cudaIdx());
    }
    if (overrides.stage1CacheSize() != null) {
      add(command, "--stage1_cache_size", overrides.stage1CacheSize());
    }
    if (overrides.stage1CacheMode() != null) {
      add(command, "--stage1_cache_mode", overrides.stage1CacheMode());
    }
    if (overrides.stage2CacheMode() != null) {
      add(command, "--stage2_cache_mode", overrides.stage2CacheMode());
    }
    if (Boolean.TRUE.equals(overrides.stage1NoGuidance())) {
      command.add("--stage1_no_guidance");
    }
    if (Boolean.TRUE.equals(overrides.keepIntermediate())) {
      command.add("--keep_intermediate");
    }
    if (Boolean.TRUE.equals(overrides.disableOffloadModel())) {
      command.add("--disable_offload_model");
    }

    command.addAll(properties.extraArgs());
    return command;
  }

  private static void add(List<String> command, String flag, Object value) {
    command.add(flag);
    command.add(String.valueOf(value));
  }

  private static <T> T firstNonNull(T override, T fallback) {
    return override != null ? override : fallback;
  }
}
