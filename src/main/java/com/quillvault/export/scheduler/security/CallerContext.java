package com.quillvault.export.scheduler.security;

import java.time.LocalDateTime;
import java.util.UUID;

/** Verified caller of the current request, published as a request attribute. */
public record CallerContext(UUID ownerId, LocalDateTime createdAt, LocalDateTime lastActive) {

  public static final String ATTRIBUTE = "com.quillvault.export.scheduler.security.CallerContext";
}
