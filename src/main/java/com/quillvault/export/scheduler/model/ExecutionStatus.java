package com.quillvault.export.scheduler.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionStatus {
  RUNNING,
  SUCCESS,
  FAILED;

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
