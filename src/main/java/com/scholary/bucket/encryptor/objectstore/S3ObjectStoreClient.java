package com.scholary.bucket.encryptor.objectstore;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>This uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The
 * key difference is the endpoint and path-style access configuration.
 *
 * <p>The SDK's own retry policy still applies to transient transport failures. Anything that
 * surfaces from a call is wrapped in {@link ObjectStoreException} with the provider's message so
 * the pipeline can record it.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private static final String CIPHERTEXT_CONTENT_TYPE = "application/octet-stream";

  private final S3Client s3Client;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    this(buildClient(properties));
  }

  public S3ObjectStoreClient(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, region={}, pathStyleAccess={}",
        properties.hasEndpoint() ? properties.endpoint() : "<aws default>",
        properties.region(),
        properties.pathStyleAccess());

    AwsCredentialsProvider credentialsProvider =
        properties.hasStaticCredentials()
            ? StaticCredentialsProvider.create(
                AwsBasicCredentials.create(properties.accessKey(), properties.secretKey()))
            : DefaultCredentialsProvider.create();

    S3ClientBuilder builder =
        S3Client.builder()
            .region(Region.of(properties.region()))
            .credentialsProvider(credentialsProvider)
            .forcePathStyle(properties.pathStyleAccess()); // Required for MinIO

    if (properties.hasEndpoint()) {
      builder.endpointOverride(URI.create(properties.endpoint()));
    }

    S3Client client = builder.build();
    LOGGER.info("S3 client initialized successfully");
    return client;
  }

  @Override
  public List<String> listObjects(String bucket) {
    LOGGER.info("Listing objects: bucket={}", bucket);

    try {
      ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(bucket).build();

      // The paginator follows continuation tokens, so buckets over 1000 keys are fully listed
      List<String> keys =
          s3Client.listObjectsV2Paginator(request).contents().stream()
              .map(S3Object::key)
              .collect(Collectors.toList());

      LOGGER.info("Listed objects: bucket={}, count={}", bucket, keys.size());
      return keys;

    } catch (NoSuchBucketException e) {
      String message = String.format("Bucket not found: bucket=%s", bucket);
      LOGGER.error(message);
      throw new ObjectStoreException(message, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to list objects: bucket=%s, statusCode=%s, error=%s",
              bucket, e.statusCode(), providerMessage(e));
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message = String.format("Unexpected error listing objects: bucket=%s", bucket);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public byte[] getObject(String bucket, String key) {
    LOGGER.info("Fetching object: bucket={}, key={}", bucket, key);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();

      ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);
      byte[] bytes = response.asByteArray();

      LOGGER.info("Object is downloaded: bucket={}, key={}, size={}", bucket, key, bytes.length);
      return bytes;

    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      throw new ObjectStoreException(message, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve object: bucket=%s, key=%s, statusCode=%s, error=%s",
              bucket, key, e.statusCode(), providerMessage(e));
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error retrieving object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public void putObject(String bucket, String key, byte[] data) {
    LOGGER.info("Uploading object: bucket={}, key={}, contentLength={}", bucket, key, data.length);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(CIPHERTEXT_CONTENT_TYPE)
              .contentLength((long) data.length)
              .build();

      s3Client.putObject(request, RequestBody.fromBytes(data));

      LOGGER.info("Uploaded a file with key {} into {}", key, bucket);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload object: bucket=%s, key=%s, statusCode=%s, error=%s",
              bucket, key, e.statusCode(), providerMessage(e));
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error uploading object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public void deleteObject(String bucket, String key) {
    LOGGER.info("Deleting object: bucket={}, key={}", bucket, key);

    try {
      DeleteObjectRequest request = DeleteObjectRequest.builder().bucket(bucket).key(key).build();

      s3Client.deleteObject(request);

      LOGGER.info("Deleted a file with key {} from {}", key, bucket);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to delete object: bucket=%s, key=%s, statusCode=%s, error=%s",
              bucket, key, e.statusCode(), providerMessage(e));
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error deleting object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  private static String providerMessage(S3Exception e) {
    if (e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null) {
      return e.awsErrorDetails().errorMessage();
    }
    return e.getMessage();
  }

  /**
   * Clean up resources when the client is no longer needed.
   *
   * <p>Spring calls this on shutdown to release connections and threads.
   */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
