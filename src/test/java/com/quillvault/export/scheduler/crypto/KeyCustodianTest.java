package com.quillvault.export.scheduler.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quillvault.export.scheduler.config.AppProperties;
import com.quillvault.export.scheduler.exception.DecryptionException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.Test;

class KeyCustodianTest {

  private static final String KEY_A =
      Base64.getEncoder().encodeToString("0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.US_ASCII));
  private static final String KEY_B =
      Base64.getEncoder().encodeToString("fedcba9876543210fedcba9876543210".getBytes(StandardCharsets.US_ASCII));

  @Test
  void unwrapsWhatItWrapped() {
    KeyCustodian custodian = custodian(KEY_A);
    custodian.validateKey();
    SecretKey key = new SecretKeySpec(new byte[32], "AES");

    String wrapped = custodian.wrap(key);

    assertThat(wrapped).startsWith("k1:");
    assertThat(custodian.unwrap(wrapped).getEncoded()).isEqualTo(key.getEncoded());
  }

  @Test
  void differentCustodyKeyCannotUnwrap() {
    String wrapped = custodian(KEY_A).wrap(new SecretKeySpec(new byte[32], "AES"));

    assertThatThrownBy(() -> custodian(KEY_B).unwrap(wrapped))
        .isInstanceOf(DecryptionException.class);
  }

  @Test
  void unknownFormatIsRejected() {
    assertThatThrownBy(() -> custodian(KEY_A).unwrap("plain-text"))
        .isInstanceOf(DecryptionException.class);
  }

  @Test
  void missingCustodyKeyFailsValidation() {
    KeyCustodian custodian = custodian("");

    assertThatThrownBy(custodian::validateKey)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("KEY_CUSTODY_SECRET");
  }

  @Test
  void shortCustodyKeyFailsValidation() {
    KeyCustodian custodian = custodian(Base64.getEncoder().encodeToString(new byte[16]));

    assertThatThrownBy(custodian::validateKey)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("16 bytes");
  }

  private static KeyCustodian custodian(String key) {
    return new KeyCustodian(
        new AppProperties(
            new AppProperties.Security("salt", key, 1000), null, null, null, null, null));
  }
}
