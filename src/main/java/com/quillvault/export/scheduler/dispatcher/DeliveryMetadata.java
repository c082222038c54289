package com.quillvault.export.scheduler.dispatcher;

import java.time.LocalDateTime;
import java.util.UUID;

public record DeliveryMetadata(
    UUID scheduleId, String scheduleName, int entryCount, LocalDateTime generatedAt) {

  public String entriesLabel() {
    return entryCount == 1 ? "1 entry" : entryCount + " entries";
  }
}
