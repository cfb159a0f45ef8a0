package com.scholary.songgen.inference;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Seam over {@link ProcessBuilder} so tests can hand back a fake {@link Process}. */
interface ProcessFactory {

  Process start(List<String> command, Path workingDir) throws IOException;
}
