package com.scholary.bucket.encryptor.crypto;

/**
 * Authenticated encryption of a whole object held in memory.
 *
 * <p>The returned ciphertext carries an integrity tag, so tampering is detected on decryption.
 */
public interface ObjectCipher {

  /**
   * Encrypt an object's bytes.
   *
   * @param plaintext the full object content
   * @param material the run's key and nonce
   * @return ciphertext followed by the authentication tag
   * @throws EncryptionException if the underlying primitive rejects the input
   */
  byte[] encrypt(byte[] plaintext, EncryptionMaterial material) throws EncryptionException;

  /** Name of the construction, for logs. */
  String getAlgorithmName();
}
