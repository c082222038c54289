package com.quillvault.export.scheduler.service;

import com.quillvault.export.scheduler.model.ExecutionTrigger;
import java.util.UUID;

/**
 * A won claim handed from the trigger loop or the API to the execution engine. A manual run may
 * carry the passphrase, which then takes precedence over the custody-held key.
 */
public record ScheduleClaim(UUID scheduleId, ExecutionTrigger trigger, char[] passphrase) {

  public static ScheduleClaim automatic(UUID scheduleId) {
    return new ScheduleClaim(scheduleId, ExecutionTrigger.AUTOMATIC, null);
  }

  public static ScheduleClaim manual(UUID scheduleId, String passphrase) {
    return new ScheduleClaim(
        scheduleId,
        ExecutionTrigger.MANUAL,
        passphrase == null || passphrase.isEmpty() ? null : passphrase.toCharArray());
  }

  public boolean hasPassphrase() {
    return passphrase != null && passphrase.length > 0;
  }

  @Override
  public String toString() {
    return "ScheduleClaim[scheduleId=" + scheduleId + ", trigger=" + trigger + "]";
  }
}
