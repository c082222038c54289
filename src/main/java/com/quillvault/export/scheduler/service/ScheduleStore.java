package com.quillvault.export.scheduler.service;

import com.quillvault.export.scheduler.exception.ScheduleConflictException;
import com.quillvault.export.scheduler.exception.ScheduleNotFoundException;
import com.quillvault.export.scheduler.model.ClaimState;
import com.quillvault.export.scheduler.model.ExecutionLog;
import com.quillvault.export.scheduler.model.ExecutionStatus;
import com.quillvault.export.scheduler.model.ExecutionTrigger;
import com.quillvault.export.scheduler.model.Schedule;
import com.quillvault.export.scheduler.repository.ExecutionLogRepository;
import com.quillvault.export.scheduler.repository.ScheduleRepository;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable source of truth for schedules, their recipients and execution history.
 *
 * <p>Every operation commits in its own transaction. Claims are single conditional updates whose
 * affected-row count decides the winner, so no explicit locks are held while an execution runs.
 */
@Service
public class ScheduleStore {
  private static final Logger log = LoggerFactory.getLogger(ScheduleStore.class);

  private static final int CLAIM_SCAN_LIMIT = 10;

  private final ScheduleRepository scheduleRepository;
  private final ExecutionLogRepository logRepository;
  private final DatabaseErrorHandlingService databaseErrors;
  private final TransactionTemplate transactionTemplate;

  public ScheduleStore(
      ScheduleRepository scheduleRepository,
      ExecutionLogRepository logRepository,
      DatabaseErrorHandlingService databaseErrors,
      PlatformTransactionManager transactionManager) {
    this.scheduleRepository = scheduleRepository;
    this.logRepository = logRepository;
    this.databaseErrors = databaseErrors;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  public enum DeletionResult {
    DELETED,
    DEFERRED
  }

  // ============ OWNER OPERATIONS ============

  public Schedule create(Schedule schedule) {
    return inTransaction("create schedule", status -> scheduleRepository.save(schedule));
  }

  public Optional<Schedule> find(UUID id) {
    return inTransaction("find schedule", status -> scheduleRepository.findById(id));
  }

  public Schedule getOwned(UUID ownerId, UUID id) {
    return inTransaction(
        "get schedule",
        status ->
            scheduleRepository
                .findByIdAndOwnerId(id, ownerId)
                .orElseThrow(() -> new ScheduleNotFoundException(id)));
  }

  public List<Schedule> listOwned(UUID ownerId) {
    return inTransaction(
        "list schedules", status -> scheduleRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId));
  }

  /**
   * Applies {@code mutation} to the owner's schedule and saves it. Refused while an attempt holds
   * the claim; a claim that lands between load and save loses the optimistic version check.
   */
  public Schedule update(UUID ownerId, UUID id, Consumer<Schedule> mutation) {
    return inTransaction(
        "update schedule",
        status -> {
          Schedule schedule =
              scheduleRepository
                  .findByIdAndOwnerId(id, ownerId)
                  .orElseThrow(() -> new ScheduleNotFoundException(id));
          if (schedule.isRunning() || schedule.isDeletionRequested()) {
            throw new ScheduleConflictException("Schedule is currently executing");
          }
          mutation.accept(schedule);
          return scheduleRepository.saveAndFlush(schedule);
        });
  }

  /** Deletes now, or records the request when an attempt is in flight. */
  public DeletionResult delete(UUID ownerId, UUID id) {
    return inTransaction(
        "delete schedule",
        status -> {
          Schedule schedule =
              scheduleRepository
                  .findByIdAndOwnerId(id, ownerId)
                  .orElseThrow(() -> new ScheduleNotFoundException(id));
          if (schedule.isRunning()) {
            schedule.setDeletionRequested(true);
            scheduleRepository.saveAndFlush(schedule);
            log.info("Deletion of running schedule {} deferred until its attempt completes", id);
            return DeletionResult.DEFERRED;
          }
          logRepository.deleteByScheduleId(id);
          scheduleRepository.delete(schedule);
          scheduleRepository.flush();
          return DeletionResult.DELETED;
        });
  }

  /**
   * Sets {@code execution_time = now + original_duration_ms} and clears {@code executed}. Logs are
   * kept.
   */
  public Schedule reset(UUID ownerId, UUID id, LocalDateTime now) {
    return inTransaction(
        "reset schedule",
        status -> {
          Schedule schedule =
              scheduleRepository
                  .findByIdAndOwnerId(id, ownerId)
                  .orElseThrow(() -> new ScheduleNotFoundException(id));
          LocalDateTime executionTime =
              now.plus(Duration.ofMillis(schedule.getOriginalDurationMs()));
          int updated =
              scheduleRepository.resetExecutionTime(
                  id, ownerId, executionTime, now, ClaimState.IDLE);
          if (updated != 1) {
            throw new ScheduleConflictException("Schedule is currently executing");
          }
          return scheduleRepository.findById(id).orElseThrow(() -> new ScheduleNotFoundException(id));
        });
  }

  public List<ExecutionLog> recentLogs(UUID scheduleId, int limit) {
    return inTransaction(
        "list execution logs",
        status ->
            logRepository.findByScheduleIdOrderByStartedAtDesc(
                scheduleId, PageRequest.of(0, limit)));
  }

  public long countActive() {
    return inTransaction("count schedules", status -> scheduleRepository.countByExecutedFalse());
  }

  // ============ CLAIMS ============

  /** Claims the earliest-due eligible schedule, if any. */
  public Optional<Schedule> claimDue(LocalDateTime now) {
    return inTransaction(
        "claim due schedule",
        status -> {
          List<UUID> candidates =
              scheduleRepository.findDueScheduleIds(
                  now, ClaimState.IDLE, PageRequest.of(0, CLAIM_SCAN_LIMIT));
          for (UUID candidate : candidates) {
            if (scheduleRepository.claimIfDue(candidate, now, ClaimState.IDLE, ClaimState.RUNNING)
                == 1) {
              log.debug("Claimed due schedule {}", candidate);
              return scheduleRepository.findById(candidate);
            }
          }
          return Optional.empty();
        });
  }

  /**
   * Claims the owner's schedule for an immediate run regardless of its due time.
   *
   * @throws ScheduleConflictException if it is already running or executed
   */
  public Schedule claimForRun(UUID ownerId, UUID id, LocalDateTime now) {
    return inTransaction(
        "claim schedule for run",
        status -> {
          int claimed =
              scheduleRepository.claimForRun(id, ownerId, now, ClaimState.IDLE, ClaimState.RUNNING);
          Schedule schedule =
              scheduleRepository
                  .findByIdAndOwnerId(id, ownerId)
                  .orElseThrow(() -> new ScheduleNotFoundException(id));
          if (claimed == 1) {
            return schedule;
          }
          if (schedule.isRunning()) {
            throw new ScheduleConflictException("Schedule is already running");
          }
          if (schedule.isExecuted()) {
            throw new ScheduleConflictException("Schedule has already been executed");
          }
          throw new ScheduleConflictException("Schedule is pending deletion");
        });
  }

  /** Gives back a claim that never started executing. */
  public void releaseClaim(UUID id) {
    inTransaction(
        "release claim",
        status -> scheduleRepository.releaseClaim(id, ClaimState.IDLE, ClaimState.RUNNING));
  }

  // ============ EXECUTION HISTORY ============

  public ExecutionLog startLog(UUID scheduleId, ExecutionTrigger trigger, LocalDateTime now) {
    return inTransaction(
        "start execution log",
        status -> logRepository.save(new ExecutionLog(scheduleId, trigger, now)));
  }

  /**
   * Writes the terminal log status, marks the schedule executed and releases its claim, then
   * carries out a deletion requested while the attempt ran.
   *
   * @return {@code true} if the schedule was deleted
   */
  public boolean complete(
      UUID scheduleId, UUID logId, ExecutionOutcome outcome, LocalDateTime now) {
    return inTransaction(
        "complete execution",
        status -> {
          ExecutionLog executionLog = logRepository.findById(logId).orElse(null);
          if (executionLog != null && executionLog.getStatus() == ExecutionStatus.RUNNING) {
            executionLog.setStatus(outcome.status());
            executionLog.setCompletedAt(now);
            executionLog.setEntryCount(outcome.entryCount());
            executionLog.setRecipientsTotal(outcome.recipientsTotal());
            executionLog.setRecipientsSent(outcome.recipientsSent());
            executionLog.setErrorMessage(outcome.errorMessage());
            logRepository.save(executionLog);
          } else {
            log.warn(
                "Execution log {} of schedule {} was already closed; keeping its status",
                logId,
                scheduleId);
          }

          if (scheduleRepository.markExecuted(scheduleId, now, ClaimState.IDLE, ClaimState.RUNNING)
              != 1) {
            log.warn("Schedule {} no longer held its claim at completion", scheduleId);
          }

          Schedule schedule = scheduleRepository.findById(scheduleId).orElse(null);
          if (schedule != null && schedule.isDeletionRequested() && !schedule.isRunning()) {
            logRepository.deleteByScheduleId(scheduleId);
            scheduleRepository.delete(schedule);
            log.info("Deleted schedule {} after its final attempt", scheduleId);
            return true;
          }
          return false;
        });
  }

  // ============ WATCHDOG ============

  public List<UUID> findStaleClaims(LocalDateTime threshold) {
    return inTransaction(
        "find stale claims",
        status -> scheduleRepository.findStaleClaimIds(threshold, ClaimState.RUNNING));
  }

  /** Fails the orphaned running log and makes the schedule claimable again. */
  public boolean abandonStaleClaim(
      UUID id, LocalDateTime threshold, LocalDateTime now, String message) {
    return inTransaction(
        "abandon stale claim",
        status -> {
          int released =
              scheduleRepository.releaseStaleClaim(
                  id, threshold, ClaimState.IDLE, ClaimState.RUNNING);
          if (released != 1) {
            return false;
          }
          logRepository.failRunningLogs(
              id, now, message, ExecutionStatus.RUNNING, ExecutionStatus.FAILED);
          Schedule schedule = scheduleRepository.findById(id).orElse(null);
          if (schedule != null && schedule.isDeletionRequested()) {
            logRepository.deleteByScheduleId(id);
            scheduleRepository.delete(schedule);
          }
          return true;
        });
  }

  private <T> T inTransaction(String operation, TransactionCallback<T> callback) {
    try {
      return transactionTemplate.execute(callback);
    } catch (OptimisticLockingFailureException e) {
      throw new ScheduleConflictException(
          "Schedule was modified concurrently, please retry", e);
    } catch (DataAccessException e) {
      throw databaseErrors.translate(operation, e);
    } catch (TransactionException e) {
      throw databaseErrors.translate(operation, e);
    }
  }
}
