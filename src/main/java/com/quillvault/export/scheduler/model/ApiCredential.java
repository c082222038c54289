package com.quillvault.export.scheduler.model;

import com.quillvault.export.scheduler.config.ClockAwareEntityListener;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "api_credentials")
@EntityListeners(ClockAwareEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
public class ApiCredential {

  @Id
  @Column(name = "credential_id", columnDefinition = "uuid")
  private UUID id;

  /** Hex SHA-256 of the key plus the configured salt; the plaintext key is never stored. */
  @Column(name = "key_hash", nullable = false, unique = true, length = 64)
  private String keyHash;

  @Column(name = "created_at", nullable = false)
  private LocalDateTime createdAt;

  @Column(name = "last_active_at")
  private LocalDateTime lastActiveAt;

  public ApiCredential(String keyHash) {
    this.keyHash = keyHash;
  }
}
