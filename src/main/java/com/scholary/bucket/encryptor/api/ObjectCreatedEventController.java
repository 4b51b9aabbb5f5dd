package com.scholary.bucket.encryptor.api;

import com.scholary.bucket.encryptor.pipeline.BatchSummary;
import com.scholary.bucket.encryptor.pipeline.EncryptionPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Event-driven trigger: encrypts the objects named in a storage event notification.
 *
 * <p>Returns no body. The status tells the sender whether every object made it; which one did not
 * is in the logs.
 */
@RestController
@Tag(name = "Events", description = "Object storage event notifications")
public class ObjectCreatedEventController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectCreatedEventController.class);

  private final EncryptionPipeline encryptionPipeline;
  private final ObjectCreatedEventFilter eventFilter;

  public ObjectCreatedEventController(
      EncryptionPipeline encryptionPipeline, ObjectCreatedEventFilter eventFilter) {
    this.encryptionPipeline = encryptionPipeline;
    this.eventFilter = eventFilter;
  }

  /**
   * Encrypt the newly created objects in a notification.
   *
   * <p>Each bucket in the notification gets its own run, and so its own key and nonce.
   */
  @PostMapping("/api/events/s3")
  @Operation(
      summary = "Handle object events",
      description = "Encrypt objects named by ObjectCreated records; other records are skipped")
  public ResponseEntity<Void> handleEvents(@RequestBody S3EventNotification notification) {
    Map<String, List<String>> keysByBucket = eventFilter.keysByBucket(notification);
    LOGGER.info(
        "Received {} event records, {} bucket(s) to process",
        notification.records().size(),
        keysByBucket.size());

    boolean failed = false;
    for (Map.Entry<String, List<String>> entry : keysByBucket.entrySet()) {
      String bucket = entry.getKey();
      try {
        BatchSummary summary = encryptionPipeline.encryptObjects(bucket, entry.getValue());
        if (summary.hasFailures()) {
          LOGGER.error("Event processing had failures: bucket={}, {}", bucket, summary);
          failed = true;
        }
      } catch (RuntimeException e) {
        LOGGER.error("Event processing aborted: bucket={}", bucket, e);
        failed = true;
      }
    }

    return failed
        ? ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build()
        : ResponseEntity.ok().build();
  }
}
