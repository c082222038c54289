package com.quillvault.export.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quillvault.export.scheduler.security.CallerContext;
import java.time.LocalDateTime;
import java.util.UUID;

public record VerifyResponse(
    @JsonProperty("user_id") UUID userId,
    @JsonProperty("created_at") LocalDateTime createdAt,
    @JsonProperty("last_active") LocalDateTime lastActive) {
  public static VerifyResponse from(CallerContext c) {
    return new VerifyResponse(c.ownerId(), c.createdAt(), c.lastActive());
  }
}
