package com.scholary.songgen.objectstore;

import java.nio.file.Path;

/** Publishes one artifact. Absent entirely when the object store is disabled. */
public interface ArtifactUploader {

  /**
   * Uploads {@code file} under {@code remoteKey}.
   *
   * @return false if the upload failed; failures are logged, never thrown
   */
  boolean upload(Path file, String remoteKey);
}
