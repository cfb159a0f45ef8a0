package com.scholary.songgen.inference;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Starts real processes with stderr merged into stdout. */
final class DefaultProcessFactory implements ProcessFactory {

  @Override
  public Process start(List<String> command, Path workingDir) throws IOException {
    ProcessBuilder builder = new ProcessBuilder(command);
    if (workingDir != null) {
      builder.directory(workingDir.toFile());
    }
    builder.redirectErrorStream(true);
    return builder.start();
  }
}
