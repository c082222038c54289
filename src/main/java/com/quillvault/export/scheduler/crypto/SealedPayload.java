package com.quillvault.export.scheduler.crypto;

import com.quillvault.export.scheduler.exception.DecryptionException;
import java.util.Base64;

/**
 * Ciphertext plus everything needed to re-derive its key from a passphrase. Persisted as {@code
 * v1:<iterations>:<salt>:<iv>:<ciphertext>} with Base64 fields.
 */
public record SealedPayload(int iterations, byte[] salt, byte[] iv, byte[] ciphertext) {

  private static final String VERSION = "v1";

  public String encode() {
    Base64.Encoder encoder = Base64.getEncoder();
    return String.join(
        ":",
        VERSION,
        Integer.toString(iterations),
        encoder.encodeToString(salt),
        encoder.encodeToString(iv),
        encoder.encodeToString(ciphertext));
  }

  public static SealedPayload parse(String encoded) {
    if (encoded == null) {
      throw new DecryptionException("Encrypted payload is missing");
    }
    String[] parts = encoded.split(":");
    if (parts.length != 5 || !VERSION.equals(parts[0])) {
      throw new DecryptionException("Encrypted payload has an unrecognised format");
    }
    try {
      Base64.Decoder decoder = Base64.getDecoder();
      return new SealedPayload(
          Integer.parseInt(parts[1]),
          decoder.decode(parts[2]),
          decoder.decode(parts[3]),
          decoder.decode(parts[4]));
    } catch (IllegalArgumentException e) {
      throw new DecryptionException("Encrypted payload is corrupted", e);
    }
  }
}
