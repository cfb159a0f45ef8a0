package com.scholary.songgen.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URL;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PresignedUrlCacheTest {

  @Mock private ObjectStoreClient client;

  @Test
  void urlFor_shouldSignOncePerKeyWhileFresh() throws Exception {
    Duration ttl = Duration.ofHours(1);
    URL signed = new URL("http://minio:9000/songs/job/song.mp3?X-Amz-Signature=abc");
    when(client.presignGet("songs", "job/song.mp3", ttl)).thenReturn(signed);
    PresignedUrlCache cache = new PresignedUrlCache(client, "songs", ttl);

    assertThat(cache.urlFor("job/song.mp3")).isEqualTo(signed);
    assertThat(cache.urlFor("job/song.mp3")).isEqualTo(signed);

    verify(client, times(1)).presignGet("songs", "job/song.mp3", ttl);
  }
}
