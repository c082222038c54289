package com.quillvault.export.scheduler.repository;

import com.quillvault.export.scheduler.model.ExecutionLog;
import com.quillvault.export.scheduler.model.ExecutionStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface ExecutionLogRepository extends JpaRepository<ExecutionLog, UUID> {

  List<ExecutionLog> findByScheduleIdOrderByStartedAtDesc(UUID scheduleId, Pageable page);

  List<ExecutionLog> findByScheduleIdOrderByStartedAtDesc(UUID scheduleId);

  long countByScheduleId(UUID scheduleId);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE ExecutionLog l
      SET l.status = :failed, l.completedAt = :now, l.errorMessage = :message
      WHERE l.scheduleId = :scheduleId AND l.status = :running
      """)
  int failRunningLogs(
      UUID scheduleId,
      LocalDateTime now,
      String message,
      ExecutionStatus running,
      ExecutionStatus failed);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM ExecutionLog l WHERE l.scheduleId = :scheduleId")
  int deleteByScheduleId(UUID scheduleId);
}
