package com.scholary.bucket.encryptor.crypto;

import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * The key and nonce used for one pipeline run.
 *
 * <p>A pair is generated once per run and applied to every object in that run; it is never cached
 * or shared with another run. Byte arrays are copied in and out so holders cannot mutate the pair.
 */
public final class EncryptionMaterial {

  public static final int KEY_LENGTH = 32;
  public static final int NONCE_LENGTH = 24;

  private final byte[] key;
  private final byte[] nonce;

  public EncryptionMaterial(byte[] key, byte[] nonce) {
    if (key == null || key.length != KEY_LENGTH) {
      throw new IllegalArgumentException(
          "Encryption key must be " + KEY_LENGTH + " bytes, got " + lengthOf(key));
    }
    if (nonce == null || nonce.length != NONCE_LENGTH) {
      throw new IllegalArgumentException(
          "Nonce must be " + NONCE_LENGTH + " bytes, got " + lengthOf(nonce));
    }
    this.key = Arrays.clone(key);
    this.nonce = Arrays.clone(nonce);
  }

  public byte[] key() {
    return Arrays.clone(key);
  }

  public byte[] nonce() {
    return Arrays.clone(nonce);
  }

  public String keyHex() {
    return Hex.toHexString(key);
  }

  public String nonceHex() {
    return Hex.toHexString(nonce);
  }

  private static String lengthOf(byte[] bytes) {
    return bytes == null ? "null" : String.valueOf(bytes.length);
  }

  /** Deliberately omits the key bytes. */
  @Override
  public String toString() {
    return "EncryptionMaterial[keyLength=" + KEY_LENGTH + ", nonceLength=" + NONCE_LENGTH + "]";
  }
}
