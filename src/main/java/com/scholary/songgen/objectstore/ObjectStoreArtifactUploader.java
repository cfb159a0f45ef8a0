package com.scholary.songgen.objectstore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

/**
 * Uploads artifacts to the configured bucket and checks the stored size against the local file.
 */
public class ObjectStoreArtifactUploader implements ArtifactUploader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreArtifactUploader.class);

  private final ObjectStoreClient client;
  private final String bucket;

  public ObjectStoreArtifactUploader(ObjectStoreClient client, String bucket) {
    this.client = client;
    this.bucket = bucket;
  }

  @Override
  public boolean upload(Path file, String remoteKey) {
    String contentType =
        MediaTypeFactory.getMediaType(file.getFileName().toString())
            .orElse(MediaType.APPLICATION_OCTET_STREAM)
            .toString();
    try {
      long localSize = Files.size(file);
      client.putFile(bucket, remoteKey, file, contentType);
      ObjectStoreClient.ObjectMetadata stored = client.getObjectMetadata(bucket, remoteKey);
      if (stored.contentLength() != localSize) {
        LOGGER.warn(
            "Uploaded size mismatch: key={}, local={} bytes, stored={} bytes",
            remoteKey,
            localSize,
            stored.contentLength());
        return false;
      }
      return true;
    } catch (IOException | ObjectStoreException e) {
      LOGGER.warn("Upload failed: file={}, key={}: {}", file, remoteKey, e.getMessage());
      return false;
    }
  }
}
