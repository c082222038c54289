package com.quillvault.export.scheduler.exception;

/** Wrong passphrase or corrupted ciphertext. Never retried. */
public class DecryptionException extends RuntimeException {

  public DecryptionException(String message) {
    super(message);
  }

  public DecryptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
