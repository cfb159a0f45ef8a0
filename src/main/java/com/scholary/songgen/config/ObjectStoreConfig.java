package com.scholary.songgen.config;

import com.scholary.songgen.objectstore.ArtifactUploader;
import com.scholary.songgen.objectstore.ObjectStoreArtifactUploader;
import com.scholary.songgen.objectstore.ObjectStoreClient;
import com.scholary.songgen.objectstore.ObjectStoreProperties;
import com.scholary.songgen.objectstore.PresignedUrlCache;
import com.scholary.songgen.objectstore.S3ObjectStoreClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Object storage beans. Only created with {@code objectstore.enabled=true}; without them finished
 * artifacts stay on local disk.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  @ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  @ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
  public ArtifactUploader artifactUploader(
      ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    return new ObjectStoreArtifactUploader(objectStoreClient, properties.bucket());
  }

  @Bean
  @ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
  public PresignedUrlCache presignedUrlCache(
      ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    return new PresignedUrlCache(objectStoreClient, properties.bucket(), properties.presignTtl());
  }
}
