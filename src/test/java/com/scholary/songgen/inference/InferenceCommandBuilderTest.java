package com.scholary.songgen.inference;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.songgen.job.InferenceTuning;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class InferenceCommandBuilderTest {

  private static final Path GENRE = Path.of("/out/job-1/genre.txt");
  private static final Path LYRICS = Path.of("/out/job-1/lyrics.txt");
  private static final Path OUTPUT = Path.of("/out/job-1");

  @Test
  void build_shouldUseConfiguredDefaults() {
    InferenceCommandBuilder builder = new InferenceCommandBuilder(properties(List.of()));

    List<String> command = builder.build(GENRE, LYRICS, OUTPUT, InferenceTuning.DEFAULTS);

    assertThat(command)
        .containsExactly(
            "python",
            "infer.py",
            "--genre_txt",
            "/out/job-1/genre.txt",
            "--lyrics_txt",
            "/out/job-1/lyrics.txt",
            "--output_dir",
            "/out/job-1",
            "--stage1_model",
            "stage1-model",
            "--stage2_model",
            "stage2-model",
            "--stage1_use_exl2",
            "--stage2_batch_size",
            "12",
            "--run_n_segments",
            "2",
            "--max_new_tokens",
            "3000",
            "--repetition_penalty",
            "1.1",
            "--stage2_cache_size",
            "32768");
  }

  @Test
  void build_shouldApplyPerJobOverrides() {
    InferenceCommandBuilder builder = new InferenceCommandBuilder(properties(List.of()));
    InferenceTuning tuning =
        new InferenceTuning(
            "custom-s1", null, 1, 4, 8, 1500, 1.3, 16384, null, "Q6", "Q4", true, null, false);

    List<String> command = builder.build(GENRE, LYRICS, OUTPUT, tuning);

    assertThat(String.join(" ", command))
        .contains("--stage1_model custom-s1")
        .contains("--stage2_model stage2-model")
        .contains("--stage2_batch_size 8")
        .contains("--run_n_segments 4")
        .contains("--max_new_tokens 1500")
        .contains("--repetition_penalty 1.3")
        .contains("--stage2_cache_size 32768")
        .contains("--cuda_idx 1")
        .contains("--stage1_cache_size 16384")
        .contains("--stage1_cache_mode Q6")
        .contains("--stage2_cache_mode Q4")
        .contains("--stage1_no_guidance")
        .doesNotContain("--keep_intermediate")
        .doesNotContain("--disable_offload_model");
  }

  @Test
  void build_shouldAppendExtraArgsLast() {
    InferenceCommandBuilder builder =
        new InferenceCommandBuilder(properties(List.of("--seed", "42")));

    List<String> command = builder.build(GENRE, LYRICS, OUTPUT, null);

    assertThat(command.subList(command.size() - 2, command.size())).containsExactly("--seed", "42");
  }

  private static InferenceProperties properties(List<String> extraArgs) {
    return new InferenceProperties(
        "python",
        "infer.py",
        ".",
        "stage1-model",
        "stage2-model",
        true,
        false,
        Duration.ofMinutes(5),
        new InferenceProperties.Defaults(12, 2, 3000, 1.1, 32768),
        extraArgs,
        List.of());
  }
}
