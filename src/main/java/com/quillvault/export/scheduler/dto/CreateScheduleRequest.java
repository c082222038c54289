package com.quillvault.export.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quillvault.export.scheduler.model.JournalEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.List;

/** Either {@code duration_ms} or {@code delay} sets when the export runs. */
public record CreateScheduleRequest(
    @Size(max = 200) String name,
    @JsonProperty("duration_ms")
        @Positive
        @Max(value = ExecutionDelay.MAX_MILLIS, message = "duration_ms may not exceed 100 years")
        Long durationMs,
    @Valid ExecutionDelay delay,
    @JsonProperty("entry_selection") @Valid EntrySelectionDto entrySelection,
    @JsonProperty("entries_data") @NotNull(message = "entries_data is required")
        List<@Valid JournalEntry> entriesData,
    @NotBlank(message = "passphrase is required") String passphrase,
    @NotEmpty(message = "at least one recipient is required") @Size(max = 20)
        List<@Valid RecipientRequest> recipients) {

  @Override
  public String toString() {
    return "CreateScheduleRequest[name="
        + name
        + ", recipients="
        + (recipients == null ? 0 : recipients.size())
        + "]";
  }
}
