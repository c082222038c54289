package com.quillvault.export.scheduler.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** What started an attempt: the trigger loop or an owner's "execute now" request. */
public enum ExecutionTrigger {
  AUTOMATIC,
  MANUAL;

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
