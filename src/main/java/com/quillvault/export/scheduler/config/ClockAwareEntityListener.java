package com.quillvault.export.scheduler.config;

import com.quillvault.export.scheduler.model.ApiCredential;
import com.quillvault.export.scheduler.model.ExecutionLog;
import com.quillvault.export.scheduler.model.Schedule;
import com.quillvault.export.scheduler.model.ScheduleRecipient;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * JPA entity listener that assigns identifiers and audit timestamps from the shared {@link Clock}
 * bean, so persisted times are UTC and follow whatever clock the context runs with.
 */
@Component
public class ClockAwareEntityListener {

  private static Clock clock;

  /** Static because JPA instantiates entity listeners itself. */
  @Autowired
  public void setClock(Clock clock) {
    ClockAwareEntityListener.clock = clock;
  }

  @PrePersist
  public void onPrePersist(Object entity) {
    LocalDateTime now = LocalDateTime.now(clock != null ? clock : Clock.systemUTC());

    if (entity instanceof Schedule) {
      Schedule schedule = (Schedule) entity;
      if (schedule.getId() == null) {
        schedule.setId(UUID.randomUUID());
      }
      schedule.setCreatedAt(now);
      schedule.setUpdatedAt(now);
    } else if (entity instanceof ScheduleRecipient) {
      ScheduleRecipient recipient = (ScheduleRecipient) entity;
      if (recipient.getId() == null) {
        recipient.setId(UUID.randomUUID());
      }
    } else if (entity instanceof ExecutionLog) {
      ExecutionLog log = (ExecutionLog) entity;
      if (log.getId() == null) {
        log.setId(UUID.randomUUID());
      }
      if (log.getStartedAt() == null) {
        log.setStartedAt(now);
      }
    } else if (entity instanceof ApiCredential) {
      ApiCredential credential = (ApiCredential) entity;
      if (credential.getId() == null) {
        credential.setId(UUID.randomUUID());
      }
      if (credential.getCreatedAt() == null) {
        credential.setCreatedAt(now);
      }
    }
  }

  @PreUpdate
  public void onPreUpdate(Object entity) {
    LocalDateTime now = LocalDateTime.now(clock != null ? clock : Clock.systemUTC());

    if (entity instanceof Schedule) {
      ((Schedule) entity).setUpdatedAt(now);
    }
  }
}
