package com.scholary.bucket.encryptor.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that can be queried in the log
 * backend. Some events carry key material in hex; the log sink must be access-controlled.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log batch started event. */
  public void logBatchStarted(
      String sourceBucket, String destinationBucket, int objectCount, String algorithm) {
    try {
      MDC.put("event_type", "batch_started");
      MDC.put("destinationBucket", destinationBucket);
      MDC.put("objectCount", String.valueOf(objectCount));

      logger.info(
          "Batch started: source={}, destination={}, objects={}, cipher={}",
          sourceBucket,
          destinationBucket,
          objectCount,
          algorithm);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage started event. */
  public void logStageStarted(String bucket, String key, String stage) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);

      logger.debug("Stage started: stage={}, bucket={}, key={}", stage, bucket, key);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage failure event. */
  public void logStageFailed(String bucket, String key, String stage, String reason) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage);
      MDC.put("reason", reason);

      logger.error(
          "Stage failed: stage={}, bucket={}, key={}, reason={}", stage, bucket, key, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log object encrypted event. Contains key material. */
  public void logObjectEncrypted(
      String key, int plaintextBytes, int ciphertextBytes, String keyHex, String nonceHex) {
    try {
      MDC.put("event_type", "object_encrypted");
      MDC.put("plaintextBytes", String.valueOf(plaintextBytes));
      MDC.put("ciphertextBytes", String.valueOf(ciphertextBytes));

      logger.info(
          "Successfully encrypted file {} with encryption key {} and nonce {}",
          key,
          keyHex,
          nonceHex);
    } finally {
      clearEventFields();
    }
  }

  /** Log object completed event. */
  public void logObjectCompleted(String sourceBucket, String destinationBucket, String key) {
    try {
      MDC.put("event_type", "object_completed");
      MDC.put("destinationBucket", destinationBucket);

      logger.info(
          "Object completed: key={}, moved from {} to {} as ciphertext",
          key,
          sourceBucket,
          destinationBucket);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch finished event. Contains key material. */
  public void logBatchFinished(
      String sourceBucket, int succeeded, int failed, String keyHex, String nonceHex) {
    try {
      MDC.put("event_type", "batch_finished");
      MDC.put("succeeded", String.valueOf(succeeded));
      MDC.put("failed", String.valueOf(failed));

      if (failed == 0) {
        logger.info(
            "Batch finished: source={}, succeeded={}, enc_key={}, nonce={}",
            sourceBucket,
            succeeded,
            keyHex,
            nonceHex);
      } else {
        logger.warn(
            "Batch finished with failures: source={}, succeeded={}, failed={}, enc_key={},"
                + " nonce={}",
            sourceBucket,
            succeeded,
            failed,
            keyHex,
            nonceHex);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Set batch context in MDC. */
  public static void setBatchContext(String correlationId, String bucket) {
    MDC.put("correlationId", correlationId);
    MDC.put("bucket", bucket);
  }

  /** Clear batch context from MDC. */
  public static void clearBatchContext() {
    MDC.remove("correlationId");
    MDC.remove("bucket");
  }

  /** Set object context in MDC. */
  public static void setObjectContext(String key) {
    MDC.put("key", key);
  }

  /** Clear object context from MDC. */
  public static void clearObjectContext() {
    MDC.remove("key");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("reason");
    MDC.remove("destinationBucket");
    MDC.remove("objectCount");
    MDC.remove("plaintextBytes");
    MDC.remove("ciphertextBytes");
    MDC.remove("succeeded");
    MDC.remove("failed");
  }
}
