package com.scholary.songgen.inference;

import java.util.List;

/** Runs the audio model. The orchestrator depends on this seam, not on process handling. */
public interface InferenceRunner {

  /**
   * Runs {@code command} to completion.
   *
   * @param command full command line, executable first
   * @param jobId used for log correlation only
   * @return exit code and any error lines the run printed
   * @throws InferenceException if the process cannot start, times out or is interrupted
   */
  InferenceResult run(List<String> command, String jobId);
}
