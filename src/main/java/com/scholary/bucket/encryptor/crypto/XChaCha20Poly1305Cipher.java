package com.scholary.bucket.encryptor.crypto;

import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.RuntimeCryptoException;
import org.bouncycastle.crypto.engines.ChaChaEngine;
import org.bouncycastle.crypto.modes.ChaCha20Poly1305;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.Pack;
import org.springframework.stereotype.Component;

/**
 * XChaCha20-Poly1305 on top of Bouncy Castle.
 *
 * <p>The extended 24-byte nonce is handled as in draft-irtf-cfrg-xchacha: HChaCha20 turns the key
 * and the first 16 nonce bytes into a subkey, and RFC 8439 ChaCha20-Poly1305 then runs under that
 * subkey with the nonce {@code 0x00000000 || nonce[16..24]}. Output is ciphertext followed by the
 * 16-byte Poly1305 tag. Objects are encrypted without associated data.
 */
@Component
public class XChaCha20Poly1305Cipher implements ObjectCipher {

  public static final int TAG_LENGTH = 16;

  private static final int MAC_SIZE_BITS = TAG_LENGTH * 8;
  private static final int ROUNDS = 20;
  private static final int HCHACHA_NONCE_LENGTH = 16;
  private static final int CHACHA_NONCE_LENGTH = 12;
  private static final byte[] NO_ASSOCIATED_DATA = new byte[0];

  // "expand 32-byte k"
  private static final int[] SIGMA = {0x61707865, 0x3320646e, 0x79622d32, 0x6b206574};

  @Override
  public byte[] encrypt(byte[] plaintext, EncryptionMaterial material) throws EncryptionException {
    return process(true, plaintext, NO_ASSOCIATED_DATA, material);
  }

  /** Encrypt with associated data bound into the tag. */
  byte[] encrypt(byte[] plaintext, byte[] associatedData, EncryptionMaterial material)
      throws EncryptionException {
    return process(true, plaintext, associatedData, material);
  }

  /**
   * Decrypt and verify a ciphertext produced by {@link #encrypt}.
   *
   * @throws EncryptionException if authentication fails
   */
  public byte[] decrypt(byte[] ciphertext, EncryptionMaterial material) throws EncryptionException {
    return process(false, ciphertext, NO_ASSOCIATED_DATA, material);
  }

  @Override
  public String getAlgorithmName() {
    return "XChaCha20-Poly1305";
  }

  private byte[] process(
      boolean forEncryption, byte[] input, byte[] associatedData, EncryptionMaterial material)
      throws EncryptionException {
    if (input == null) {
      throw new EncryptionException("Input must not be null");
    }

    byte[] nonce = material.nonce();
    byte[] subkey = hChaCha20(material.key(), Arrays.copyOfRange(nonce, 0, HCHACHA_NONCE_LENGTH));
    byte[] chachaNonce = new byte[CHACHA_NONCE_LENGTH];
    System.arraycopy(nonce, HCHACHA_NONCE_LENGTH, chachaNonce, 4, 8);

    try {
      ChaCha20Poly1305 aead = new ChaCha20Poly1305();
      aead.init(
          forEncryption,
          new AEADParameters(new KeyParameter(subkey), MAC_SIZE_BITS, chachaNonce));
      aead.processAADBytes(associatedData, 0, associatedData.length);

      byte[] output = new byte[aead.getOutputSize(input.length)];
      int written = aead.processBytes(input, 0, input.length, output, 0);
      written += aead.doFinal(output, written);

      return written == output.length ? output : Arrays.copyOfRange(output, 0, written);

    } catch (InvalidCipherTextException e) {
      throw new EncryptionException("Authentication failed: " + e.getMessage(), e);
    } catch (IllegalArgumentException | IllegalStateException | RuntimeCryptoException e) {
      // Bouncy Castle signals bad parameters and buffer misuse with unchecked exceptions
      throw new EncryptionException(
          String.format("%s failed: %s", getAlgorithmName(), e.getMessage()), e);
    } finally {
      Arrays.fill(subkey, (byte) 0);
    }
  }

  /**
   * HChaCha20: the ChaCha20 block function without the final feed-forward, keeping state words
   * 0..3 and 12..15 as the subkey.
   */
  static byte[] hChaCha20(byte[] key, byte[] nonce16) {
    int[] state = new int[16];
    System.arraycopy(SIGMA, 0, state, 0, 4);
    Pack.littleEndianToInt(key, 0, state, 4, 8);
    Pack.littleEndianToInt(nonce16, 0, state, 12, 4);

    int[] mixed = new int[16];
    ChaChaEngine.chachaCore(ROUNDS, state, mixed);

    // chachaCore adds the input state back in; HChaCha20 must not
    int[] subkeyWords = new int[8];
    for (int i = 0; i < 4; i++) {
      subkeyWords[i] = mixed[i] - state[i];
      subkeyWords[i + 4] = mixed[i + 12] - state[i + 12];
    }
    return Pack.intToLittleEndian(subkeyWords);
  }
}
