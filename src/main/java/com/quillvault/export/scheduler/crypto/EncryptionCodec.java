package com.quillvault.export.scheduler.crypto;

import com.quillvault.export.scheduler.exception.DecryptionException;
import javax.crypto.SecretKey;

/** Passphrase-based symmetric encryption of the entry snapshot. */
public interface EncryptionCodec {

  SealedPayload encrypt(byte[] plaintext, char[] passphrase);

  /**
   * @throws DecryptionException when the passphrase is wrong or the payload was tampered with
   */
  default byte[] decrypt(SealedPayload payload, char[] passphrase) {
    return decrypt(payload, deriveKey(payload, passphrase));
  }

  /** Re-derives the content key using the salt and iteration count recorded in the payload. */
  SecretKey deriveKey(SealedPayload payload, char[] passphrase);

  byte[] decrypt(SealedPayload payload, SecretKey key);
}
