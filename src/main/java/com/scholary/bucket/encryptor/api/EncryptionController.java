package com.scholary.bucket.encryptor.api;

import com.scholary.bucket.encryptor.config.EncryptionProperties;
import com.scholary.bucket.encryptor.objectstore.ObjectStoreException;
import com.scholary.bucket.encryptor.pipeline.BatchSummary;
import com.scholary.bucket.encryptor.pipeline.EncryptionPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * On-demand trigger: rescans the configured source bucket and encrypts everything in it.
 *
 * <p>The response is deliberately coarse. Per-object detail is only in the logs.
 */
@RestController
@Tag(name = "Encryption", description = "Encrypt bucket objects into the encrypted bucket")
public class EncryptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(EncryptionController.class);

  static final String FAILURE_MESSAGE =
      "Encountered errors while processing files! Please check the logs for more details!";
  static final String LIST_FAILURE_MESSAGE = "Can not list files from bucket";

  private final EncryptionPipeline encryptionPipeline;
  private final String sourceBucket;

  public EncryptionController(
      EncryptionPipeline encryptionPipeline, EncryptionProperties properties) {
    this.encryptionPipeline = encryptionPipeline;
    this.sourceBucket = properties.sourceBucket();
  }

  /**
   * Encrypt every object in the source bucket.
   *
   * <p>Always 200 once the bucket has been listed, 502 if it could not be. The key and nonce are only returned when every
   * object succeeded; on partial failure they are in the logs.
   */
  @RequestMapping(
      value = "/api/encrypt",
      method = {RequestMethod.GET, RequestMethod.POST},
      produces = MediaType.TEXT_PLAIN_VALUE)
  @Operation(
      summary = "Encrypt bucket",
      description = "List the source bucket, encrypt each object and delete the plaintext")
  public ResponseEntity<String> encryptBucket() {
    LOGGER.info("Encryption requested: bucket={}", sourceBucket);

    BatchSummary summary;
    try {
      summary = encryptionPipeline.encryptBucket(sourceBucket);
    } catch (ObjectStoreException e) {
      LOGGER.error("Can not list bucket: bucket={}, reason={}", sourceBucket, e.getMessage());
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
          .contentType(MediaType.TEXT_PLAIN)
          .body(LIST_FAILURE_MESSAGE);
    }

    String message =
        summary.hasFailures()
            ? FAILURE_MESSAGE
            : String.format(
                "Successfully encrypted all files with enc_key=%s and nonce=%s",
                summary.keyHex(), summary.nonceHex());

    LOGGER.info("Encryption request finished: bucket={}, {}", sourceBucket, summary);
    return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(message);
  }
}
