package com.quillvault.export.scheduler.security;

import java.time.LocalDateTime;
import java.util.UUID;

/** A newly issued key. The plaintext is only ever available here, once. */
public record IssuedCredential(UUID ownerId, String apiKey, LocalDateTime createdAt) { }
