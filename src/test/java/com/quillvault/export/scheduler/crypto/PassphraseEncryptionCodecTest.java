package com.quillvault.export.scheduler.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quillvault.export.scheduler.exception.DecryptionException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class PassphraseEncryptionCodecTest {

  private final PassphraseEncryptionCodec codec = new PassphraseEncryptionCodec(1000);

  @Test
  void decryptsWithTheSamePassphrase() {
    byte[] plaintext = "[{\"id\":\"e1\"}]".getBytes(StandardCharsets.UTF_8);

    SealedPayload sealed = codec.encrypt(plaintext, "correct horse".toCharArray());
    byte[] opened = codec.decrypt(SealedPayload.parse(sealed.encode()), "correct horse".toCharArray());

    assertThat(opened).isEqualTo(plaintext);
    assertThat(sealed.iterations()).isEqualTo(1000);
    assertThat(sealed.salt()).hasSize(16);
    assertThat(sealed.iv()).hasSize(12);
  }

  @Test
  void sameInputEncryptsDifferentlyEachTime() {
    byte[] plaintext = "hello".getBytes(StandardCharsets.UTF_8);

    String first = codec.encrypt(plaintext, "pw".toCharArray()).encode();
    String second = codec.encrypt(plaintext, "pw".toCharArray()).encode();

    assertThat(first).isNotEqualTo(second);
  }

  @Test
  void wrongPassphraseFailsWithDecryptionException() {
    SealedPayload sealed = codec.encrypt("secret".getBytes(StandardCharsets.UTF_8), "right".toCharArray());

    assertThatThrownBy(() -> codec.decrypt(sealed, "wrong".toCharArray()))
        .isInstanceOf(DecryptionException.class)
        .hasMessageContaining("wrong passphrase");
  }

  @Test
  void tamperedCiphertextIsRejected() {
    SealedPayload sealed = codec.encrypt("secret".getBytes(StandardCharsets.UTF_8), "pw".toCharArray());
    byte[] tampered = sealed.ciphertext().clone();
    tampered[0] ^= 0x01;

    SealedPayload modified = new SealedPayload(sealed.iterations(), sealed.salt(), sealed.iv(), tampered);

    assertThatThrownBy(() -> codec.decrypt(modified, "pw".toCharArray()))
        .isInstanceOf(DecryptionException.class);
  }

  @Test
  void derivedKeyDecryptsWithoutThePassphrase() {
    SealedPayload sealed = codec.encrypt("data".getBytes(StandardCharsets.UTF_8), "pw".toCharArray());

    byte[] opened = codec.decrypt(sealed, codec.deriveKey(sealed, "pw".toCharArray()));

    assertThat(new String(opened, StandardCharsets.UTF_8)).isEqualTo("data");
  }

  @Test
  void malformedPayloadIsRejected() {
    assertThatThrownBy(() -> SealedPayload.parse("v2:1:a:b:c"))
        .isInstanceOf(DecryptionException.class);
    assertThatThrownBy(() -> SealedPayload.parse("v1:1000:!!:b:c"))
        .isInstanceOf(DecryptionException.class);
  }

  @Test
  void emptyPassphraseIsRefused() {
    assertThatThrownBy(() -> codec.encrypt(new byte[] {1}, new char[0]))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
