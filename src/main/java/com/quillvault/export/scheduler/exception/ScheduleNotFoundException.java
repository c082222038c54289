package com.quillvault.export.scheduler.exception;

import java.util.UUID;

/** Unknown schedule, or one owned by a different credential; both look the same to callers. */
public class ScheduleNotFoundException extends RuntimeException {

  private final UUID scheduleId;

  public ScheduleNotFoundException(UUID scheduleId) {
    super("Schedule not found: " + scheduleId);
    this.scheduleId = scheduleId;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }
}
