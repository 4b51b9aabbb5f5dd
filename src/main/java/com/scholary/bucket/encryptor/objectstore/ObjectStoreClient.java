package com.scholary.bucket.encryptor.objectstore;

import java.util.List;

/**
 * Abstraction for the object storage operations the encryption pipeline needs.
 *
 * <p>Each call is independent and the client holds no per-call state. Production uses {@link
 * S3ObjectStoreClient}; tests substitute an in-memory implementation so the pipeline's branching
 * can be exercised without a network.
 */
public interface ObjectStoreClient {

  /**
   * List every object key in a bucket.
   *
   * @param bucket the bucket name
   * @return all keys, in the order the backend returns them
   * @throws ObjectStoreException if the bucket cannot be listed
   */
  List<String> listObjects(String bucket);

  /**
   * Download a whole object into memory.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return the object's bytes
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  byte[] getObject(String bucket, String key);

  /**
   * Store an object, replacing any existing object under the same key.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the object's bytes
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(String bucket, String key, byte[] data);

  /**
   * Delete an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @throws ObjectStoreException if the delete fails
   */
  void deleteObject(String bucket, String key);
}
