package com.quillvault.export.scheduler.crypto;

import com.quillvault.export.scheduler.config.AppProperties;
import com.quillvault.export.scheduler.exception.DecryptionException;
import jakarta.annotation.PostConstruct;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * Holds passphrase-derived snapshot keys on the server so schedules can run unattended. Each key
 * is wrapped with AES-GCM under the custody key ({@code app.security.custody-key}, Base64, 32
 * bytes); the passphrase itself is never kept.
 */
@Component
public class KeyCustodian {

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final String VERSION = "k1";
  private static final int GCM_TAG_LENGTH = 128;
  private static final int IV_LENGTH = 12;

  private final SecretKeySpec custodyKey;
  private final SecureRandom secureRandom = new SecureRandom();

  public KeyCustodian(AppProperties appProps) {
    String encodedKey = appProps.security() != null ? appProps.security().custodyKey() : null;
    if (encodedKey == null || encodedKey.isBlank()) {
      this.custodyKey = null; // rejected in validateKey()
    } else {
      this.custodyKey = new SecretKeySpec(Base64.getDecoder().decode(encodedKey.trim()), "AES");
    }
  }

  @PostConstruct
  void validateKey() {
    if (custodyKey == null) {
      throw new IllegalStateException(
          "KEY_CUSTODY_SECRET is not set. Cannot start without a custody key for schedule keys.");
    }
    if (custodyKey.getEncoded().length != 32) {
      throw new IllegalStateException(
          "KEY_CUSTODY_SECRET must be a Base64-encoded 256-bit (32-byte) key. Got "
              + custodyKey.getEncoded().length
              + " bytes.");
    }
  }

  public String wrap(SecretKey key) {
    byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, custodyKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] wrapped = cipher.doFinal(key.getEncoded());
      Base64.Encoder encoder = Base64.getEncoder();
      return VERSION + ":" + encoder.encodeToString(iv) + ":" + encoder.encodeToString(wrapped);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Key wrapping failed", e);
    }
  }

  public SecretKey unwrap(String custody) {
    String[] parts = custody == null ? new String[0] : custody.split(":");
    if (parts.length != 3 || !VERSION.equals(parts[0])) {
      throw new DecryptionException("Stored schedule key has an unrecognised format");
    }
    try {
      byte[] iv = Base64.getDecoder().decode(parts[1]);
      byte[] wrapped = Base64.getDecoder().decode(parts[2]);
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, custodyKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      return new SecretKeySpec(cipher.doFinal(wrapped), "AES");
    } catch (AEADBadTagException e) {
      throw new DecryptionException("Stored schedule key cannot be unwrapped with the custody key", e);
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new DecryptionException("Stored schedule key is corrupted", e);
    }
  }
}
