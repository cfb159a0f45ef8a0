package com.scholary.songgen.objectstore;

import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Bucket operations needed to publish and serve job artifacts.
 *
 * <p>Every method throws {@link ObjectStoreException} on failure.
 */
public interface ObjectStoreClient {

  /** Uploads a local file, replacing any object already stored under {@code key}. */
  void putFile(String bucket, String key, Path file, String contentType);

  /**
   * Opens an object for reading. The caller closes the stream.
   *
   * @throws ObjectStoreException if the object does not exist
   */
  InputStream getObjectStream(String bucket, String key);

  /** Temporary download URL that expires after {@code ttl}. */
  URL presignGet(String bucket, String key, Duration ttl);

  /** Size and content type of a stored object, without downloading it. */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  record ObjectMetadata(long contentLength, String contentType) {}
}
