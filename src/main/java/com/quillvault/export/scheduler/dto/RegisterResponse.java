package com.quillvault.export.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quillvault.export.scheduler.security.IssuedCredential;
import java.time.LocalDateTime;
import java.util.UUID;

public record RegisterResponse(
    @JsonProperty("user_id") UUID userId,
    @JsonProperty("api_key") String apiKey,
    @JsonProperty("created_at") LocalDateTime createdAt,
    String message) {
  public static RegisterResponse from(IssuedCredential c) {
    return new RegisterResponse(
        c.ownerId(),
        c.apiKey(),
        c.createdAt(),
        "Store this API key securely. It will not be shown again.");
  }
}
