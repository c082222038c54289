package com.quillvault.export.scheduler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillvault.export.scheduler.crypto.EncryptionCodec;
import com.quillvault.export.scheduler.crypto.KeyCustodian;
import com.quillvault.export.scheduler.crypto.SealedPayload;
import com.quillvault.export.scheduler.exception.DecryptionException;
import com.quillvault.export.scheduler.model.JournalEntry;
import com.quillvault.export.scheduler.model.Schedule;
import java.io.IOException;
import java.util.List;
import javax.crypto.SecretKey;
import org.springframework.stereotype.Service;

/** Serializes entry snapshots to JSON and seals/opens them with the encryption codec. */
@Service
public class EntrySnapshotService {

  private static final TypeReference<List<JournalEntry>> ENTRY_LIST = new TypeReference<>() { };

  private final EncryptionCodec codec;
  private final KeyCustodian custodian;
  private final ObjectMapper objectMapper;

  public EntrySnapshotService(
      EncryptionCodec codec, KeyCustodian custodian, ObjectMapper objectMapper) {
    this.codec = codec;
    this.custodian = custodian;
    this.objectMapper = objectMapper;
  }

  public record SealedSnapshot(String encryptedPayload, String keyCustody) { }

  public SealedSnapshot seal(List<JournalEntry> entries, String passphrase) {
    byte[] json;
    try {
      json = objectMapper.writeValueAsBytes(entries);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Entries could not be serialized: " + e.getMessage(), e);
    }
    char[] secret = passphrase.toCharArray();
    SealedPayload payload = codec.encrypt(json, secret);
    SecretKey key = codec.deriveKey(payload, secret);
    return new SealedSnapshot(payload.encode(), custodian.wrap(key));
  }

  /**
   * Decrypts the schedule's snapshot with the supplied passphrase, or with the custody-held key
   * when none is given.
   *
   * @throws DecryptionException on a wrong passphrase or an unreadable payload
   */
  public List<JournalEntry> open(Schedule schedule, char[] passphrase) {
    SealedPayload payload = SealedPayload.parse(schedule.getEncryptedPayload());
    byte[] json =
        passphrase != null && passphrase.length > 0
            ? codec.decrypt(payload, passphrase)
            : codec.decrypt(payload, custodian.unwrap(schedule.getKeyCustody()));
    try {
      return objectMapper.readValue(json, ENTRY_LIST);
    } catch (IOException e) {
      throw new DecryptionException("Decrypted snapshot is not a valid entry list", e);
    }
  }
}
