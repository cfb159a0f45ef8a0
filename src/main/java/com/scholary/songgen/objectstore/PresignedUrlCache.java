package com.scholary.songgen.objectstore;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.net.URL;
import java.time.Duration;

/**
 * Reuses presigned download URLs while they are still comfortably valid, so status polling does not
 * sign a fresh URL on every request.
 */
public class PresignedUrlCache {

  private static final long MAX_ENTRIES = 10_000;

  private final ObjectStoreClient client;
  private final String bucket;
  private final Duration ttl;
  private final Cache<String, URL> cache;

  public PresignedUrlCache(ObjectStoreClient client, String bucket, Duration ttl) {
    this.client = client;
    this.bucket = bucket;
    this.ttl = ttl;
    // cached URLs always have at least half their signature lifetime left
    this.cache =
        Caffeine.newBuilder().maximumSize(MAX_ENTRIES).expireAfterWrite(ttl.dividedBy(2)).build();
  }

  /**
   * @throws ObjectStoreException if signing fails
   */
  public URL urlFor(String remoteKey) {
    return cache.get(remoteKey, key -> client.presignGet(bucket, key, ttl));
  }
}
