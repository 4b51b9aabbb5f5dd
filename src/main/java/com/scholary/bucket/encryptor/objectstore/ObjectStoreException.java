package com.scholary.bucket.encryptor.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Unchecked, because the pipeline treats the provider's error as opaque: the message is
 * recorded against the affected key and the batch moves on. A failure to list a bucket is the one
 * case that aborts a whole invocation.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
