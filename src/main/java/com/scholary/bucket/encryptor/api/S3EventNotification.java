package com.scholary.bucket.encryptor.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * S3 event notification document.
 *
 * <p>Only the fields the pipeline reads are mapped. The same shape is posted by S3 (forwarded
 * through SNS or EventBridge) and by MinIO bucket-notification webhooks.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record S3EventNotification(@JsonProperty("Records") List<EventRecord> records) {

  public S3EventNotification {
    records = records == null ? List.of() : records;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record EventRecord(String eventName, S3Entity s3) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record S3Entity(Bucket bucket, S3Object object) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Bucket(String name) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record S3Object(String key, Long size) {}
}
