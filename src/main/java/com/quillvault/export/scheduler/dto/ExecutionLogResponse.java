package com.quillvault.export.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quillvault.export.scheduler.model.ExecutionLog;
import com.quillvault.export.scheduler.model.ExecutionStatus;
import com.quillvault.export.scheduler.model.ExecutionTrigger;
import java.time.LocalDateTime;
import java.util.UUID;

public record ExecutionLogResponse(
    UUID id,
    ExecutionStatus status,
    ExecutionTrigger trigger,
    @JsonProperty("started_at") LocalDateTime startedAt,
    @JsonProperty("completed_at") LocalDateTime completedAt,
    @JsonProperty("entry_count") Integer entryCount,
    @JsonProperty("recipients_total") Integer recipientsTotal,
    @JsonProperty("recipients_sent") Integer recipientsSent,
    @JsonProperty("error_message") String errorMessage) {
  public static ExecutionLogResponse from(ExecutionLog l) {
    return new ExecutionLogResponse(
        l.getId(),
        l.getStatus(),
        l.getTrigger(),
        l.getStartedAt(),
        l.getCompletedAt(),
        l.getEntryCount(),
        l.getRecipientsTotal(),
        l.getRecipientsSent(),
        l.getErrorMessage());
  }
}
