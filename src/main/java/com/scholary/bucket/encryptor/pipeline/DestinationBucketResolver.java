package com.scholary.bucket.encryptor.pipeline;

import com.scholary.bucket.encryptor.config.EncryptionProperties;
import com.scholary.bucket.encryptor.config.EncryptionProperties.DestinationNaming;
import org.springframework.stereotype.Component;

/** Picks the bucket that receives ciphertext for a given source bucket. */
@Component
public class DestinationBucketResolver {

  private final DestinationNaming naming;
  private final String suffix;
  private final String explicitBucket;

  public DestinationBucketResolver(EncryptionProperties properties) {
    this.naming = properties.destinationNaming();
    this.suffix = properties.destinationSuffix();
    this.explicitBucket = properties.destinationBucket();
  }

  /**
   * Resolve the destination for a source bucket.
   *
   * @throws IllegalArgumentException if the result would be the source bucket itself, since
   *     storing there and then deleting the source would destroy the ciphertext
   */
  public String resolve(String sourceBucket) {
    String destination =
        naming == DestinationNaming.EXPLICIT ? explicitBucket : sourceBucket + suffix;

    if (destination.equals(sourceBucket)) {
      throw new IllegalArgumentException(
          "Destination bucket resolves to the source bucket: " + sourceBucket);
    }
    return destination;
  }
}
