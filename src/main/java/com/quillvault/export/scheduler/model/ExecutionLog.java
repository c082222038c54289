package com.quillvault.export.scheduler.model;

import com.quillvault.export.scheduler.config.ClockAwareEntityListener;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "execution_logs")
@EntityListeners(ClockAwareEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
public class ExecutionLog {

  @Id
  @Column(name = "log_id", columnDefinition = "uuid")
  private UUID id;

  @Column(name = "schedule_id", nullable = false, columnDefinition = "uuid")
  private UUID scheduleId;

  @Enumerated(EnumType.STRING)
  @Column(name = "trigger_type", nullable = false)
  private ExecutionTrigger trigger;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false)
  private ExecutionStatus status;

  @Column(name = "started_at", nullable = false)
  private LocalDateTime startedAt;

  @Column(name = "completed_at")
  private LocalDateTime completedAt;

  @Column(name = "entry_count")
  private Integer entryCount;

  @Column(name = "recipients_total")
  private Integer recipientsTotal;

  @Column(name = "recipients_sent")
  private Integer recipientsSent;

  @Column(name = "error_message", columnDefinition = "text")
  private String errorMessage;

  public ExecutionLog(UUID scheduleId, ExecutionTrigger trigger, LocalDateTime startedAt) {
    this.scheduleId = scheduleId;
    this.trigger = trigger;
    this.status = ExecutionStatus.RUNNING;
    this.startedAt = startedAt;
  }
}
