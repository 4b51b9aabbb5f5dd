package com.scholary.bucket.encryptor.crypto;

import java.security.SecureRandom;
import org.springframework.stereotype.Component;

/**
 * Produces a fresh key and nonce for each pipeline run.
 *
 * <p>{@link SecureRandom} is thread-safe and self-seeding; it is never seeded explicitly here.
 */
@Component
public class EncryptionMaterialGenerator {

  private final SecureRandom secureRandom;

  public EncryptionMaterialGenerator() {
    this(new SecureRandom());
  }

  EncryptionMaterialGenerator(SecureRandom secureRandom) {
    this.secureRandom = secureRandom;
  }

  public EncryptionMaterial generate() {
    byte[] key = new byte[EncryptionMaterial.KEY_LENGTH];
    byte[] nonce = new byte[EncryptionMaterial.NONCE_LENGTH];
    secureRandom.nextBytes(key);
    secureRandom.nextBytes(nonce);
    return new EncryptionMaterial(key, nonce);
  }
}
