package com.scholary.bucket.encryptor.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class XChaCha20Poly1305CipherTest {

  // draft-irtf-cfrg-xchacha-03, appendix A.3.1
  private static final byte[] VECTOR_KEY =
      Hex.decode("808182838485868788898a8b8c8d8e8f909192939495969798999a9b9c9d9e9f");
  private static final byte[] VECTOR_NONCE =
      Hex.decode("404142434445464748494a4b4c4d4e4f5051525354555657");
  private static final byte[] VECTOR_AAD = Hex.decode("50515253c0c1c2c3c4c5c6c7");
  private static final byte[] VECTOR_PLAINTEXT =
      ("Ladies and Gentlemen of the class of '99: If I could offer you only one tip for the"
              + " future, sunscreen would be it.")
          .getBytes(StandardCharsets.US_ASCII);
  private static final String VECTOR_CIPHERTEXT_HEX =
      "bd6d179d3e83d43b9576579493c0e939572a1700252bfaccbed2902c21396cbb"
          + "731c7f1b0b4aa6440bf3a82f4eda7e39ae64c6708c54c216cb96b72e1213b452"
          + "2f8c9ba40db5d945b11b69b982c1bb9e3f3fac2bc369488f76b2383565d3fff9"
          + "21f9664c97637da9768812f615c68b13b52e";

  private final XChaCha20Poly1305Cipher cipher = new XChaCha20Poly1305Cipher();
  private final EncryptionMaterialGenerator generator = new EncryptionMaterialGenerator();

  @Test
  void hChaCha20_matchesDraftVector() {
    byte[] key = new byte[32];
    for (int i = 0; i < key.length; i++) {
      key[i] = (byte) i;
    }
    byte[] nonce = Hex.decode("000000090000004a0000000031415927");

    byte[] subkey = XChaCha20Poly1305Cipher.hChaCha20(key, nonce);

    assertThat(Hex.toHexString(subkey))
        .isEqualTo("82413b4227b27bfed30e42508a877d73a0f9e4d58a74a853c12ec41326d3ecdc");
  }

  @Test
  void encrypt_withAssociatedData_matchesDraftVector() throws Exception {
    EncryptionMaterial material = new EncryptionMaterial(VECTOR_KEY, VECTOR_NONCE);

    byte[] ciphertext = cipher.encrypt(VECTOR_PLAINTEXT, VECTOR_AAD, material);

    assertThat(Hex.toHexString(ciphertext))
        .isEqualTo(VECTOR_CIPHERTEXT_HEX + "c0875924c1c7987947deafd8780acf49");
  }

  @Test
  void encrypt_withoutAssociatedData_matchesKnownAnswer() throws Exception {
    EncryptionMaterial material = new EncryptionMaterial(VECTOR_KEY, VECTOR_NONCE);

    byte[] ciphertext = cipher.encrypt(VECTOR_PLAINTEXT, material);

    // Same keystream as the draft vector; only the tag changes without associated data
    assertThat(Hex.toHexString(ciphertext))
        .isEqualTo(VECTOR_CIPHERTEXT_HEX + "f7e62efbf45089db18f9c8a3f0e41e5f");
    assertThat(cipher.decrypt(ciphertext, material)).isEqualTo(VECTOR_PLAINTEXT);
  }

  @Test
  void encrypt_thenDecrypt_returnsOriginalBytes() throws Exception {
    EncryptionMaterial material = generator.generate();
    byte[] plaintext = "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.UTF_8);

    byte[] ciphertext = cipher.encrypt(plaintext, material);

    assertThat(ciphertext).hasSize(plaintext.length + XChaCha20Poly1305Cipher.TAG_LENGTH);
    assertThat(Arrays.copyOf(ciphertext, plaintext.length)).isNotEqualTo(plaintext);
    assertThat(cipher.decrypt(ciphertext, material)).isEqualTo(plaintext);
  }

  @Test
  void encrypt_largeBuffer_roundTrips() throws Exception {
    EncryptionMaterial material = generator.generate();
    byte[] plaintext = new byte[3 * 1024 * 1024 + 17];
    for (int i = 0; i < plaintext.length; i++) {
      plaintext[i] = (byte) (i * 31);
    }

    byte[] ciphertext = cipher.encrypt(plaintext, material);

    assertThat(cipher.decrypt(ciphertext, material)).isEqualTo(plaintext);
  }

  @Test
  void encrypt_isDeterministicForSameMaterial() throws Exception {
    EncryptionMaterial material = generator.generate();
    byte[] plaintext = {1, 2, 3, 4};

    assertThat(cipher.encrypt(plaintext, material)).isEqualTo(cipher.encrypt(plaintext, material));
  }

  @Test
  void encrypt_nonceChangesCiphertext() throws Exception {
    byte[] key = new byte[EncryptionMaterial.KEY_LENGTH];
    byte[] nonceA = new byte[EncryptionMaterial.NONCE_LENGTH];
    byte[] nonceB = new byte[EncryptionMaterial.NONCE_LENGTH];
    // Differ only in the HChaCha20 part of the nonce
    nonceB[0] = 1;
    byte[] plaintext = new byte[64];

    byte[] a = cipher.encrypt(plaintext, new EncryptionMaterial(key, nonceA));
    byte[] b = cipher.encrypt(plaintext, new EncryptionMaterial(key, nonceB));

    assertThat(a).isNotEqualTo(b);
  }

  @Test
  void encrypt_trailingNonceBytesChangeCiphertext() throws Exception {
    byte[] key = new byte[EncryptionMaterial.KEY_LENGTH];
    byte[] nonceA = new byte[EncryptionMaterial.NONCE_LENGTH];
    byte[] nonceB = new byte[EncryptionMaterial.NONCE_LENGTH];
    nonceB[EncryptionMaterial.NONCE_LENGTH - 1] = 1;
    byte[] plaintext = new byte[64];

    byte[] a = cipher.encrypt(plaintext, new EncryptionMaterial(key, nonceA));
    byte[] b = cipher.encrypt(plaintext, new EncryptionMaterial(key, nonceB));

    assertThat(a).isNotEqualTo(b);
  }

  @Test
  void decrypt_tamperedCiphertext_isDetected() throws Exception {
    EncryptionMaterial material = generator.generate();
    byte[] ciphertext = cipher.encrypt("secret".getBytes(StandardCharsets.UTF_8), material);
    ciphertext[0] ^= 0x01;

    assertThatThrownBy(() -> cipher.decrypt(ciphertext, material))
        .isInstanceOf(EncryptionException.class)
        .hasMessageContaining("Authentication failed");
  }

  @Test
  void decrypt_withOtherMaterial_fails() throws Exception {
    byte[] ciphertext = cipher.encrypt(new byte[] {42}, generator.generate());

    assertThatThrownBy(() -> cipher.decrypt(ciphertext, generator.generate()))
        .isInstanceOf(EncryptionException.class);
  }

  @Test
  void decrypt_truncatedInput_isReportedNotThrownRaw() {
    EncryptionMaterial material = generator.generate();

    assertThatThrownBy(() -> cipher.decrypt(new byte[5], material))
        .isInstanceOf(EncryptionException.class);
  }

  @Test
  void encrypt_nullInput_isReported() {
    assertThatThrownBy(() -> cipher.encrypt(null, generator.generate()))
        .isInstanceOf(EncryptionException.class);
  }

  @Test
  void hChaCha20_dependsOnEveryInputWord() {
    byte[] key = new byte[32];
    byte[] nonce = new byte[16];
    byte[] base = XChaCha20Poly1305Cipher.hChaCha20(key, nonce);

    byte[] otherKey = key.clone();
    otherKey[31] = 1;
    byte[] otherNonce = nonce.clone();
    otherNonce[15] = 1;

    assertThat(base).hasSize(32);
    assertThat(XChaCha20Poly1305Cipher.hChaCha20(otherKey, nonce)).isNotEqualTo(base);
    assertThat(XChaCha20Poly1305Cipher.hChaCha20(key, otherNonce)).isNotEqualTo(base);
  }
}
