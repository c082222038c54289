package com.quillvault.export.scheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DeliveryChannel {
  EMAIL,
  SMS;

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static DeliveryChannel fromWireName(String value) {
    if (value == null) {
      return null;
    }
    for (DeliveryChannel channel : values()) {
      if (channel.name().equalsIgnoreCase(value.trim())) {
        return channel;
      }
    }
    throw new IllegalArgumentException("Unsupported recipient channel: " + value);
  }
}
