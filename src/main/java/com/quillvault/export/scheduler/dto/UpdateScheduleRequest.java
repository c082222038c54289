package com.quillvault.export.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quillvault.export.scheduler.model.JournalEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Partial update; absent fields are left unchanged. New {@code entries_data} must come with the
 * {@code passphrase} to seal it.
 */
public record UpdateScheduleRequest(
    @Size(max = 200) String name,
    @JsonProperty("duration_ms")
        @Positive
        @Max(value = ExecutionDelay.MAX_MILLIS, message = "duration_ms may not exceed 100 years")
        Long durationMs,
    @Valid ExecutionDelay delay,
    @JsonProperty("entry_selection") @Valid EntrySelectionDto entrySelection,
    @JsonProperty("entries_data") List<@Valid JournalEntry> entriesData,
    String passphrase,
    @Size(min = 1, max = 20) List<@Valid RecipientRequest> recipients,
    @JsonProperty("reset_timer") Boolean resetTimer) {

  public boolean hasDelay() {
    return durationMs != null || delay != null;
  }

  @Override
  public String toString() {
    return "UpdateScheduleRequest[name=" + name + "]";
  }
}
