package com.scholary.songgen.job;

/**
 * Optional per-job overrides for the audio inference command. Null fields fall back to the
 * configured defaults.
 */
public record InferenceTuning(
    String stage1Model,
    String stage2Model,
    Integer cudaIdx,
    Integer runNSegments,
    Integer stage2BatchSize,
    Integer maxNewTokens,
    Double repetitionPenalty,
    Integer stage1CacheSize,
    Integer stage2CacheSize,
    String stage1CacheMode,
    String stage2CacheMode,
    Boolean stage1NoGuidance,
    Boolean keepIntermediate,
    Boolean disableOffloadModel) {

  public static final InferenceTuning DEFAULTS =
      new InferenceTuning(
          null, null, null, null, null, null, null, null, null, null, null, null, null, null);
}
