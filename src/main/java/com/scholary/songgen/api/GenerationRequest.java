package com.scholary.songgen.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.scholary.songgen.job.InferenceTuning;
import com.scholary.songgen.job.JobInput;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Body of {@code POST /generate}. Either {@code prompt}, or both {@code genre} (or {@code genres})
 * and {@code lyrics}, must be present. Snake-case aliases are accepted for existing clients.
 */
public record GenerationRequest(
    @Size(max = 4000) String prompt,
    @Size(max = 200) String genre,
    @Size(max = 10) List<@NotBlank @Size(max = 200) String> genres,
    @Size(max = 20000) String lyrics,
    @JsonAlias("song_name") @Size(max = 200) String songName,
    @JsonAlias("user_id") @Size(max = 200) String userId,
    @JsonAlias("stage1_model") String stage1Model,
    @JsonAlias("stage2_model") String stage2Model,
    @JsonAlias("cuda_idx") @Min(0) @Max(15) Integer cudaIdx,
    @JsonAlias("run_n_segments") @Min(1) @Max(20) Integer runNSegments,
    @JsonAlias("stage2_batch_size") @Min(1) @Max(64) Integer stage2BatchSize,
    @JsonAlias("max_new_tokens") @Min(100) @Max(10000) Integer maxNewTokens,
    @JsonAlias("repetition_penalty") @DecimalMin("1.0") @DecimalMax("2.0")
        Double repetitionPenalty,
    @JsonAlias("stage1_cache_size") @Positive Integer stage1CacheSize,
    @JsonAlias("stage2_cache_size") @Positive Integer stage2CacheSize,
    @JsonAlias("stage1_cache_mode") String stage1CacheMode,
    @JsonAlias("stage2_cache_mode") String stage2CacheMode,
    @JsonAlias("stage1_no_guidance") Boolean stage1NoGuidance,
    @JsonAlias("keep_intermediate") Boolean keepIntermediate,
    @JsonAlias("disable_offload_model") Boolean disableOffloadModel) {

  public JobInput toJobInput() {
    InferenceTuning tuning =
        new InferenceTuning(
            stage1Model,
            stage2Model,
            cudaIdx,
            runNSegments,
            stage2BatchSize,
            maxNewTokens,
            repetitionPenalty,
            stage1CacheSize,
            stage2CacheSize,
            stage1CacheMode,
            stage2CacheMode,
            stage1NoGuidance,
            keepIntermediate,
            disableOffloadModel);
    return new JobInput(prompt, genre, genres, lyrics, songName, userId, tuning);
  }
}
