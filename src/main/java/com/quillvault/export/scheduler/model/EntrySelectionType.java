package com.quillvault.export.scheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EntrySelectionType {
  ALL,
  SPECIFIC,
  DATE_RANGE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static EntrySelectionType fromWireName(String value) {
    if (value == null) {
      return null;
    }
    for (EntrySelectionType type : values()) {
      if (type.name().equalsIgnoreCase(value.trim())) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unsupported entry selection type: " + value);
  }
}
