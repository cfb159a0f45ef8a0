package com.scholary.songgen.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.nio.file.Path;

/**
 * Where one produced artifact lives. {@code remoteKey} is set only when the object store accepted
 * the upload.
 */
public record ArtifactLocation(String localPath, String remoteKey) {

  public static ArtifactLocation local(Path path) {
    return new ArtifactLocation(path.toString(), null);
  }

  public static ArtifactLocation uploaded(Path path, String remoteKey) {
    return new ArtifactLocation(path.toString(), remoteKey);
  }

  @JsonIgnore
  public boolean isRemote() {
    return remoteKey != null && !remoteKey.isBlank();
  }
}
