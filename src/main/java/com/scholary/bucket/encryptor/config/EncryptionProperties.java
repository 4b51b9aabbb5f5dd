package com.scholary.bucket.encryptor.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the encryption pipeline.
 *
 * <p>Bound from the "encryption.*" keys in application.yml. A missing source bucket, or a missing
 * destination bucket under explicit naming, fails application startup.
 */
@ConfigurationProperties(prefix = "encryption")
@Validated
public record EncryptionProperties(
    @NotBlank String sourceBucket,
    DestinationNaming destinationNaming,
    String destinationSuffix,
    String destinationBucket,
    @Positive Integer workerThreads,
    @Positive Integer workerQueueCapacity) {

  /** How the encrypted bucket's name is chosen. */
  public enum DestinationNaming {
    /** Source bucket name plus {@code destinationSuffix}. */
    SUFFIX,
    /** {@code destinationBucket}, whatever the source bucket. */
    EXPLICIT
  }

  // Provide defaults
  public EncryptionProperties {
    if (destinationNaming == null) {
      destinationNaming = DestinationNaming.SUFFIX;
    }
    if (destinationSuffix == null || destinationSuffix.isEmpty()) {
      destinationSuffix = "-encrypted";
    }
    if (workerThreads == null) {
      workerThreads = 1;
    }
    if (workerQueueCapacity == null) {
      workerQueueCapacity = 100;
    }
  }

  @AssertTrue(message = "encryption.destination-bucket is required for EXPLICIT naming")
  public boolean isDestinationConfigured() {
    return destinationNaming != DestinationNaming.EXPLICIT
        || (destinationBucket != null && !destinationBucket.isBlank());
  }

  @AssertTrue(message = "encryption.destination-bucket must differ from encryption.source-bucket")
  public boolean isDestinationDistinct() {
    return destinationNaming != DestinationNaming.EXPLICIT
        || destinationBucket == null
        || !destinationBucket.equals(sourceBucket);
  }
}
