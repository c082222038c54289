package com.quillvault.export.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillvault.export.scheduler.config.AppProperties;
import com.quillvault.export.scheduler.crypto.KeyCustodian;
import com.quillvault.export.scheduler.crypto.PassphraseEncryptionCodec;
import com.quillvault.export.scheduler.exception.DecryptionException;
import com.quillvault.export.scheduler.model.JournalEntry;
import com.quillvault.export.scheduler.model.Schedule;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EntrySnapshotServiceTest {

  private static final String CUSTODY_KEY = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";

  private final List<JournalEntry> entries =
      List.of(
          new JournalEntry("e1", "Monday", "<p>Rain again.</p>", 1_767_225_600_000L, null),
          new JournalEntry("e2", null, "<p>Sun.</p>", 1_767_312_000_000L, 1_767_312_100_000L));

  private EntrySnapshotService service;

  @BeforeEach
  void setUp() {
    AppProperties props =
        new AppProperties(
            new AppProperties.Security("salt", CUSTODY_KEY, 1000), null, null, null, null, null);
    service =
        new EntrySnapshotService(
            new PassphraseEncryptionCodec(props), new KeyCustodian(props), new ObjectMapper());
  }

  @Test
  void openWithPassphraseOrCustodyKeyYieldsSameEntries() {
    Schedule schedule = sealedSchedule("my passphrase");

    assertThat(service.open(schedule, "my passphrase".toCharArray())).isEqualTo(entries);
    assertThat(service.open(schedule, null)).isEqualTo(entries);
  }

  @Test
  void payloadNeverContainsPlaintext() {
    Schedule schedule = sealedSchedule("my passphrase");

    assertThat(schedule.getEncryptedPayload())
        .startsWith("v1:1000:")
        .doesNotContain("Rain again")
        .doesNotContain("my passphrase");
  }

  @Test
  void wrongPassphraseTakesPrecedenceAndFails() {
    Schedule schedule = sealedSchedule("my passphrase");

    assertThatThrownBy(() -> service.open(schedule, "other".toCharArray()))
        .isInstanceOf(DecryptionException.class);
  }

  @Test
  void corruptedCustodyIsReported() {
    Schedule schedule = sealedSchedule("my passphrase");
    schedule.setKeyCustody("k1:AAAA:AAAA");

    assertThatThrownBy(() -> service.open(schedule, null))
        .isInstanceOf(DecryptionException.class);
  }

  private Schedule sealedSchedule(String passphrase) {
    EntrySnapshotService.SealedSnapshot sealed = service.seal(entries, passphrase);
    Schedule schedule = new Schedule();
    schedule.setEncryptedPayload(sealed.encryptedPayload());
    schedule.setKeyCustody(sealed.keyCustody());
    return schedule;
  }
}
