package com.scholary.songgen.objectstore;

import java.io.InputStream;
import java.net.URI;
import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/**
 * S3 implementation of {@link ObjectStoreClient}, also usable against MinIO and other
 * S3-compatible stores through {@code endpoint} and {@code pathStyleAccess}.
 *
 * <p>The SDK retries transient failures on its own. Anything that still fails is logged and
 * rethrown as {@link ObjectStoreException}; a missing key is reported without a stack trace.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    StaticCredentialsProvider credentials =
        StaticCredentialsProvider.create(
            AwsBasicCredentials.create(properties.accessKey(), properties.secretKey()));
    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;
    URI endpoint = URI.create(properties.endpoint());

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentials)
            .endpointOverride(endpoint)
            .forcePathStyle(properties.pathStyleAccess())
            .build();
    this.s3Presigner =
        S3Presigner.builder()
            .region(region)
            .credentialsProvider(credentials)
            .endpointOverride(endpoint)
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(properties.pathStyleAccess())
                    .build())
            .build();
  }

  @Override
  public void putFile(String bucket, String key, Path file, String contentType) {
    call(
        "upload",
        bucket,
        key,
        () -> {
          PutObjectRequest request =
              PutObjectRequest.builder().bucket(bucket).key(key).contentType(contentType).build();
          s3Client.putObject(request, RequestBody.fromFile(file));
          LOGGER.info("Uploaded {} to bucket={}, key={}", file.getFileName(), bucket, key);
          return null;
        });
  }

  @Override
  public InputStream getObjectStream(String bucket, String key) {
    return call(
        "download",
        bucket,
        key,
        () -> s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build()));
  }

  @Override
  public URL presignGet(String bucket, String key, Duration ttl) {
    return call(
        "presign",
        bucket,
        key,
        () -> {
          GetObjectPresignRequest request =
              GetObjectPresignRequest.builder()
                  .signatureDuration(ttl)
                  .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key).build())
                  .build();
          return s3Presigner.presignGetObject(request).url();
        });
  }

  @Override
  public ObjectMetadata getObjectMetadata(String bucket, String key) {
    return call(
        "head",
        bucket,
        key,
        () -> {
          HeadObjectResponse response =
              s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
          return new ObjectMetadata(response.contentLength(), response.contentType());
        });
  }

  private static <T> T call(String operation, String bucket, String key, Supplier<T> action) {
    LOGGER.debug("S3 {}: bucket={}, key={}", operation, bucket, key);
    try {
      return action.get();
    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.warn(message);
      throw new ObjectStoreException(message, e);
    } catch (S3Exception e) {
      String message =
          String.format(
              "S3 %s failed: bucket=%s, key=%s, statusCode=%s",
              operation, bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error during S3 %s: bucket=%s, key=%s", operation, bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public void close() {
    LOGGER.info("Closing S3 client and presigner");
    s3Client.close();
    s3Presigner.close();
  }
}
