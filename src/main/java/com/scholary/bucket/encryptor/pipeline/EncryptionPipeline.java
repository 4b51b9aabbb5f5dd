package com.scholary.bucket.encryptor.pipeline;

import com.scholary.bucket.encryptor.crypto.EncryptionMaterial;
import com.scholary.bucket.encryptor.crypto.EncryptionMaterialGenerator;
import com.scholary.bucket.encryptor.crypto.ObjectCipher;
import com.scholary.bucket.encryptor.logging.StructuredLogger;
import com.scholary.bucket.encryptor.objectstore.ObjectStoreClient;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Moves plaintext objects into the encrypted bucket.
 *
 * <p>Every object goes through fetch, encrypt, store and delete, in that order, each attempted
 * once. The first failing stage ends that object's trip and is recorded as its outcome; the batch
 * carries on with the next object. Delete only ever runs after a successful store, so a failure
 * can leave a plaintext object next to its ciphertext but never lose it.
 *
 * <p>One {@link EncryptionMaterial} is generated per run and shared read-only by every object in
 * it. Objects are handed to the pipeline executor; with a single worker that executor runs them on
 * the calling thread, one after another. Outcomes are always reported in input order.
 */
@Service
public class EncryptionPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(EncryptionPipeline.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ObjectStoreClient objectStoreClient;
  private final ObjectCipher objectCipher;
  private final EncryptionMaterialGenerator materialGenerator;
  private final DestinationBucketResolver destinationResolver;
  private final Executor executor;

  public EncryptionPipeline(
      ObjectStoreClient objectStoreClient,
      ObjectCipher objectCipher,
      EncryptionMaterialGenerator materialGenerator,
      DestinationBucketResolver destinationResolver,
      @Qualifier("pipelineExecutor") Executor executor) {
    this.objectStoreClient = objectStoreClient;
    this.objectCipher = objectCipher;
    this.materialGenerator = materialGenerator;
    this.destinationResolver = destinationResolver;
    this.executor = executor;
  }

  /**
   * Encrypt every object currently in a bucket.
   *
   * @param sourceBucket the bucket to scan
   * @return the batch summary
   * @throws com.scholary.bucket.encryptor.objectstore.ObjectStoreException if the bucket cannot be
   *     listed; nothing is processed in that case
   */
  public BatchSummary encryptBucket(String sourceBucket) {
    List<String> keys = objectStoreClient.listObjects(sourceBucket);
    return encryptObjects(sourceBucket, keys);
  }

  /**
   * Encrypt the given objects of one bucket with freshly generated material.
   *
   * @param sourceBucket the bucket holding the objects
   * @param keys the object keys, processed in this order
   * @return the batch summary
   */
  public BatchSummary encryptObjects(String sourceBucket, List<String> keys) {
    String destinationBucket = destinationResolver.resolve(sourceBucket);
    return run(sourceBucket, destinationBucket, keys, materialGenerator.generate());
  }

  /**
   * Run the pipeline over a list of keys.
   *
   * @param sourceBucket the bucket holding the plaintext objects
   * @param destinationBucket the bucket receiving ciphertext
   * @param keys the object keys, processed in this order
   * @param material the key and nonce for this run only
   * @return one outcome per key, in input order, plus the run's material in hex
   */
  public BatchSummary run(
      String sourceBucket, String destinationBucket, List<String> keys, EncryptionMaterial material) {
    StructuredLogger.setBatchContext(UUID.randomUUID().toString(), sourceBucket);

    try {
      structuredLogger.logBatchStarted(
          sourceBucket, destinationBucket, keys.size(), objectCipher.getAlgorithmName());

      List<CompletableFuture<ProcessingOutcome>> pending = new ArrayList<>(keys.size());
      for (String key : keys) {
        pending.add(submit(sourceBucket, destinationBucket, key, material));
      }

      // Joining in submission order keeps outcomes aligned with the input keys
      List<ProcessingOutcome> outcomes = new ArrayList<>(pending.size());
      for (CompletableFuture<ProcessingOutcome> future : pending) {
        outcomes.add(future.join());
      }

      BatchSummary summary = new BatchSummary(outcomes, material.keyHex(), material.nonceHex());
      structuredLogger.logBatchFinished(
          sourceBucket,
          summary.successCount(),
          summary.failureCount(),
          summary.keyHex(),
          summary.nonceHex());
      return summary;

    } finally {
      StructuredLogger.clearBatchContext();
    }
  }

  private CompletableFuture<ProcessingOutcome> submit(
      String sourceBucket, String destinationBucket, String key, EncryptionMaterial material) {
    try {
      return CompletableFuture.supplyAsync(
          () -> processObject(sourceBucket, destinationBucket, key, material), executor);
    } catch (RejectedExecutionException e) {
      // Only happens once the pool is shutting down; the object is left untouched
      return CompletableFuture.completedFuture(
          failed(sourceBucket, key, PipelineStage.FETCH, e));
    }
  }

  /**
   * Take one object through every stage, stopping at the first failure.
   *
   * <p>Anything thrown, errors included, is recorded against the stage that was running so the
   * batch still gets its summary.
   */
  ProcessingOutcome processObject(
      String sourceBucket, String destinationBucket, String key, EncryptionMaterial material) {
    StructuredLogger.setObjectContext(key);
    PipelineStage stage = PipelineStage.FETCH;

    try {
      structuredLogger.logStageStarted(sourceBucket, key, stage.name());
      byte[] plaintext = objectStoreClient.getObject(sourceBucket, key);

      stage = PipelineStage.ENCRYPT;
      structuredLogger.logStageStarted(sourceBucket, key, stage.name());
      byte[] ciphertext = objectCipher.encrypt(plaintext, material);
      structuredLogger.logObjectEncrypted(
          key, plaintext.length, ciphertext.length, material.keyHex(), material.nonceHex());

      // A failed store leaves the plaintext where it is: delete is never reached
      stage = PipelineStage.STORE;
      structuredLogger.logStageStarted(destinationBucket, key, stage.name());
      objectStoreClient.putObject(destinationBucket, key, ciphertext);

      stage = PipelineStage.DELETE;
      structuredLogger.logStageStarted(sourceBucket, key, stage.name());
      objectStoreClient.deleteObject(sourceBucket, key);

      structuredLogger.logObjectCompleted(sourceBucket, destinationBucket, key);
      return ProcessingOutcome.success(key);

    } catch (Exception | Error e) {
      String bucket = stage == PipelineStage.STORE ? destinationBucket : sourceBucket;
      return failed(bucket, key, stage, e);
    } finally {
      StructuredLogger.clearObjectContext();
    }
  }

  private ProcessingOutcome failed(String bucket, String key, PipelineStage stage, Throwable e) {
    String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    structuredLogger.logStageFailed(bucket, key, stage.name(), reason);
    return ProcessingOutcome.failed(key, stage, reason);
  }
}
