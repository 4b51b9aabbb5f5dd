package com.scholary.bucket.encryptor.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. An empty endpoint means the
 * default AWS endpoint for the region; set it for MinIO or other S3-compatible services. Empty
 * credentials fall back to the SDK's default credentials chain.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    String endpoint,
    String accessKey,
    String secretKey,
    @NotBlank String region,
    boolean pathStyleAccess) {

  public boolean hasEndpoint() {
    return endpoint != null && !endpoint.isBlank();
  }

  public boolean hasStaticCredentials() {
    return accessKey != null && !accessKey.isBlank() && secretKey != null && !secretKey.isBlank();
  }
}
