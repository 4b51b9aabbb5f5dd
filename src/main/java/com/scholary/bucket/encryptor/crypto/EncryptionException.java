package com.scholary.bucket.encryptor.crypto;

/**
 * Exception thrown when the cipher rejects its input.
 *
 * <p>Checked, so every caller of {@link ObjectCipher} has to decide what a failed encryption means
 * for the object at hand. The pipeline records it against the key instead of aborting the batch.
 */
public class EncryptionException extends Exception {

  public EncryptionException(String message) {
    super(message);
  }

  public EncryptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
