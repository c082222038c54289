package com.quillvault.export.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.quillvault.export.scheduler.model.ExecutionLog;
import com.quillvault.export.scheduler.model.Schedule;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/** Schedule as returned by the API; never includes the encrypted payload or key material. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleResponse(
    UUID id,
    String name,
    @JsonProperty("execution_time") LocalDateTime executionTime,
    @JsonProperty("original_duration_ms") long originalDurationMs,
    @JsonProperty("entry_selection") EntrySelectionDto entrySelection,
    @JsonProperty("entry_count") int entryCount,
    List<RecipientResponse> recipients,
    boolean executed,
    @JsonProperty("executed_at") LocalDateTime executedAt,
    String state,
    @JsonProperty("created_at") LocalDateTime createdAt,
    @JsonProperty("updated_at") LocalDateTime updatedAt,
    List<ExecutionLogResponse> logs) {

  public static ScheduleResponse from(Schedule s) {
    return from(s, null);
  }

  public static ScheduleResponse from(Schedule s, List<ExecutionLog> logs) {
    return new ScheduleResponse(
        s.getId(),
        s.getName(),
        s.getExecutionTime(),
        s.getOriginalDurationMs(),
        EntrySelectionDto.from(s.getEntrySelection()),
        s.getEntryCount(),
        s.getRecipients().stream().map(RecipientResponse::from).collect(Collectors.toList()),
        s.isExecuted(),
        s.getExecutedAt(),
        stateOf(s),
        s.getCreatedAt(),
        s.getUpdatedAt(),
        logs == null
            ? null
            : logs.stream().map(ExecutionLogResponse::from).collect(Collectors.toList()));
  }

  private static String stateOf(Schedule s) {
    if (s.isDeletionRequested()) {
      return "deleting";
    }
    if (s.isRunning()) {
      return "running";
    }
    return s.isExecuted() ? "executed" : "scheduled";
  }
}
