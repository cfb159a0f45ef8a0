package com.scholary.songgen.inference;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one inference run.
 *
 * @param errorLines output lines that matched a configured error marker, in order
 */
public record InferenceResult(int exitCode, List<String> errorLines, Duration elapsed) {

  public InferenceResult {
    errorLines = errorLines == null ? List.of() : List.copyOf(errorLines);
  }

  public boolean isSuccess() {
    return exitCode == 0 && errorLines.isEmpty();
  }

  public String describeFailure() {
    if (exitCode != 0) {
      return errorLines.isEmpty()
          ? "Inference exited with code " + exitCode
          : "Inference exited with code " + exitCode + ": " + errorLines.get(0);
    }
    if (!errorLines.isEmpty()) {
      return "Inference reported an error: " + errorLines.get(0);
    }
    return "Inference succeeded";
  }
}
