package com.quillvault.export.scheduler.crypto;

import com.quillvault.export.scheduler.config.AppProperties;
import com.quillvault.export.scheduler.exception.DecryptionException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.spec.KeySpec;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** AES-256-GCM with a PBKDF2-HMAC-SHA256 key derived from the passphrase. */
@Component
public class PassphraseEncryptionCodec implements EncryptionCodec {

  private static final Logger log = LoggerFactory.getLogger(PassphraseEncryptionCodec.class);

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final String KDF = "PBKDF2WithHmacSHA256";
  private static final int GCM_TAG_LENGTH = 128; // bits
  private static final int IV_LENGTH = 12; // bytes
  private static final int SALT_LENGTH = 16; // bytes
  private static final int KEY_LENGTH = 256; // bits
  private static final int DEFAULT_ITERATIONS = 210_000;

  private final int iterations;
  private final SecureRandom secureRandom = new SecureRandom();

  @Autowired
  public PassphraseEncryptionCodec(AppProperties appProps) {
    this(
        appProps.security() != null && appProps.security().pbkdf2Iterations() != null
            ? appProps.security().pbkdf2Iterations()
            : DEFAULT_ITERATIONS);
  }

  public PassphraseEncryptionCodec(int iterations) {
    if (iterations < 1) {
      throw new IllegalArgumentException("PBKDF2 iteration count must be positive");
    }
    this.iterations = iterations;
  }

  @Override
  public SealedPayload encrypt(byte[] plaintext, char[] passphrase) {
    requirePassphrase(passphrase);
    byte[] salt = randomBytes(SALT_LENGTH);
    byte[] iv = randomBytes(IV_LENGTH);
    SecretKey key = derive(passphrase, salt, iterations);
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      return new SealedPayload(iterations, salt, iv, cipher.doFinal(plaintext));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Encryption failed", e);
    }
  }

  @Override
  public SecretKey deriveKey(SealedPayload payload, char[] passphrase) {
    requirePassphrase(passphrase);
    if (payload.iterations() < 1) {
      throw new DecryptionException("Encrypted payload has an invalid iteration count");
    }
    return derive(passphrase, payload.salt(), payload.iterations());
  }

  @Override
  public byte[] decrypt(SealedPayload payload, SecretKey key) {
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, payload.iv()));
      return cipher.doFinal(payload.ciphertext());
    } catch (AEADBadTagException e) {
      throw new DecryptionException("Decryption failed: wrong passphrase or corrupted data", e);
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      log.debug("Cipher rejected payload: {}", e.getMessage());
      throw new DecryptionException("Decryption failed: " + e.getMessage(), e);
    }
  }

  private SecretKey derive(char[] passphrase, byte[] salt, int rounds) {
    try {
      KeySpec spec = new PBEKeySpec(passphrase, salt, rounds, KEY_LENGTH);
      byte[] encoded = SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
      return new SecretKeySpec(encoded, "AES");
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Key derivation failed", e);
    }
  }

  private byte[] randomBytes(int length) {
    byte[] bytes = new byte[length];
    secureRandom.nextBytes(bytes);
    return bytes;
  }

  private static void requirePassphrase(char[] passphrase) {
    if (passphrase == null || passphrase.length == 0) {
      throw new IllegalArgumentException("Passphrase must not be empty");
    }
  }
}
