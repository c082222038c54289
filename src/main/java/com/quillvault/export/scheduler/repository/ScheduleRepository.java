package com.quillvault.export.scheduler.repository;

import com.quillvault.export.scheduler.model.ClaimState;
import com.quillvault.export.scheduler.model.Schedule;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface ScheduleRepository extends JpaRepository<Schedule, UUID> {

  Optional<Schedule> findByIdAndOwnerId(UUID id, UUID ownerId);

  List<Schedule> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

  long countByExecutedFalse();

  @Query(
      """
      SELECT s.id FROM Schedule s
      WHERE s.executed = false
        AND s.claimState = :idle
        AND s.deletionRequested = false
        AND s.executionTime <= :now
      ORDER BY s.executionTime ASC, s.createdAt ASC
      """)
  List<UUID> findDueScheduleIds(LocalDateTime now, ClaimState idle, Pageable page);

  /**
   * Claims a due schedule. The WHERE clause re-checks every eligibility condition, so of several
   * concurrent callers exactly one sees an update count of 1.
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Schedule s
      SET s.claimState = :running, s.claimedAt = :now, s.version = s.version + 1
      WHERE s.id = :id
        AND s.executed = false
        AND s.claimState = :idle
        AND s.deletionRequested = false
        AND s.executionTime <= :now
      """)
  int claimIfDue(UUID id, LocalDateTime now, ClaimState idle, ClaimState running);

  /** Manual claim: same guard as {@link #claimIfDue} without the due-time condition. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Schedule s
      SET s.claimState = :running, s.claimedAt = :now, s.version = s.version + 1
      WHERE s.id = :id
        AND s.ownerId = :ownerId
        AND s.executed = false
        AND s.claimState = :idle
        AND s.deletionRequested = false
      """)
  int claimForRun(UUID id, UUID ownerId, LocalDateTime now, ClaimState idle, ClaimState running);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Schedule s
      SET s.claimState = :idle, s.claimedAt = null, s.version = s.version + 1
      WHERE s.id = :id AND s.claimState = :running
      """)
  int releaseClaim(UUID id, ClaimState idle, ClaimState running);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Schedule s
      SET s.executed = true,
          s.executedAt = COALESCE(s.executedAt, :now),
          s.claimState = :idle,
          s.claimedAt = null,
          s.updatedAt = :now,
          s.version = s.version + 1
      WHERE s.id = :id AND s.claimState = :running
      """)
  int markExecuted(UUID id, LocalDateTime now, ClaimState idle, ClaimState running);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Schedule s
      SET s.executionTime = :executionTime,
          s.executed = false,
          s.updatedAt = :now,
          s.version = s.version + 1
      WHERE s.id = :id
        AND s.ownerId = :ownerId
        AND s.claimState = :idle
        AND s.deletionRequested = false
      """)
  int resetExecutionTime(
      UUID id, UUID ownerId, LocalDateTime executionTime, LocalDateTime now, ClaimState idle);

  @Query(
      """
      SELECT s.id FROM Schedule s
      WHERE s.claimState = :running AND s.claimedAt < :threshold
      ORDER BY s.claimedAt ASC
      """)
  List<UUID> findStaleClaimIds(LocalDateTime threshold, ClaimState running);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Schedule s
      SET s.claimState = :idle, s.claimedAt = null, s.version = s.version + 1
      WHERE s.id = :id AND s.claimState = :running AND s.claimedAt < :threshold
      """)
  int releaseStaleClaim(UUID id, LocalDateTime threshold, ClaimState idle, ClaimState running);
}
