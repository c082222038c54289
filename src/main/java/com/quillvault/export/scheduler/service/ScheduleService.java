package com.quillvault.export.scheduler.service;

import com.quillvault.export.scheduler.dto.CreateScheduleRequest;
import com.quillvault.export.scheduler.dto.EntrySelectionDto;
import com.quillvault.export.scheduler.dto.ExecutionDelay;
import com.quillvault.export.scheduler.dto.RecipientRequest;
import com.quillvault.export.scheduler.dto.ScheduleResponse;
import com.quillvault.export.scheduler.dto.UpdateScheduleRequest;
import com.quillvault.export.scheduler.exception.DecryptionException;
import com.quillvault.export.scheduler.jobs.ExecutionWorkerPool;
import com.quillvault.export.scheduler.model.DeliveryChannel;
import com.quillvault.export.scheduler.model.EntrySelection;
import com.quillvault.export.scheduler.model.JournalEntry;
import com.quillvault.export.scheduler.model.Schedule;
import com.quillvault.export.scheduler.model.ScheduleRecipient;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Owner-facing schedule operations behind the HTTP API. */
@Service
@RequiredArgsConstructor
public class ScheduleService {
  private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

  static final String DEFAULT_NAME = "Untitled Schedule";
  static final int DETAIL_LOG_LIMIT = 10;

  private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
  private static final Pattern PHONE = Pattern.compile("^\\+?[1-9]\\d{6,14}$");

  private final ScheduleStore store;
  private final EntrySnapshotService snapshots;
  private final ExecutionWorkerPool workerPool;
  private final Clock clock;

  public ScheduleResponse create(UUID ownerId, CreateScheduleRequest request) {
    long durationMs = resolveDelay(request.durationMs(), request.delay());
    EntrySelection selection = toSelection(request.entrySelection());
    List<ScheduleRecipient> recipients = toRecipients(request.recipients());
    int entryCount = countMatching(selection, request.entriesData());

    EntrySnapshotService.SealedSnapshot sealed =
        snapshots.seal(request.entriesData(), request.passphrase());

    Schedule schedule = new Schedule();
    schedule.setOwnerId(ownerId);
    schedule.setName(nameOrDefault(request.name()));
    schedule.setOriginalDurationMs(durationMs);
    schedule.setExecutionTime(now().plus(Duration.ofMillis(durationMs)));
    schedule.applyEntrySelection(selection);
    schedule.setEntryCount(entryCount);
    schedule.setEncryptedPayload(sealed.encryptedPayload());
    schedule.setKeyCustody(sealed.keyCustody());
    schedule.replaceRecipients(recipients);

    Schedule saved = store.create(schedule);
    log.info(
        "Created schedule {} for owner {}: {} entries, {} recipients, due {}",
        saved.getId(),
        ownerId,
        entryCount,
        recipients.size(),
        saved.getExecutionTime());
    return ScheduleResponse.from(saved);
  }

  public List<ScheduleResponse> list(UUID ownerId) {
    return store.listOwned(ownerId).stream()
        .map(ScheduleResponse::from)
        .collect(Collectors.toList());
  }

  /** Schedule with its most recent execution logs, newest first. */
  public ScheduleResponse get(UUID ownerId, UUID scheduleId) {
    Schedule schedule = store.getOwned(ownerId, scheduleId);
    return ScheduleResponse.from(schedule, store.recentLogs(scheduleId, DETAIL_LOG_LIMIT));
  }

  public ScheduleResponse update(UUID ownerId, UUID scheduleId, UpdateScheduleRequest request) {
    Schedule updated =
        store.update(ownerId, scheduleId, schedule -> applyUpdate(schedule, request));
    log.info("Updated schedule {}", scheduleId);
    return ScheduleResponse.from(updated);
  }

  public ScheduleStore.DeletionResult delete(UUID ownerId, UUID scheduleId) {
    ScheduleStore.DeletionResult result = store.delete(ownerId, scheduleId);
    log.info("Delete of schedule {}: {}", scheduleId, result);
    return result;
  }

  /** Recomputes the due time from the original delay; prior logs are kept. */
  public ScheduleResponse reset(UUID ownerId, UUID scheduleId) {
    Schedule schedule = store.reset(ownerId, scheduleId, now());
    log.info("Reset schedule {}, now due {}", scheduleId, schedule.getExecutionTime());
    return ScheduleResponse.from(schedule);
  }

  /**
   * Claims the schedule and queues it for immediate execution. The claim is the same conditional
   * update the trigger loop uses, so the two can never both run it.
   */
  public ScheduleResponse executeNow(UUID ownerId, UUID scheduleId, String passphrase) {
    Schedule claimed = store.claimForRun(ownerId, scheduleId, now());
    workerPool.submit(ScheduleClaim.manual(scheduleId, passphrase));
    log.info("Manual execution of schedule {} accepted", scheduleId);
    return ScheduleResponse.from(claimed);
  }

  public long countActive() {
    return store.countActive();
  }

  private void applyUpdate(Schedule schedule, UpdateScheduleRequest request) {
    boolean resetTimer = Boolean.TRUE.equals(request.resetTimer());
    if (schedule.isExecuted() && !resetTimer) {
      throw new IllegalArgumentException(
          "Schedule has already been executed; reset it before making changes");
    }

    if (request.name() != null) {
      schedule.setName(nameOrDefault(request.name()));
    }

    if (request.hasDelay()) {
      long durationMs = resolveDelay(request.durationMs(), request.delay());
      schedule.setOriginalDurationMs(durationMs);
      schedule.setExecutionTime(now().plus(Duration.ofMillis(durationMs)));
    } else if (resetTimer) {
      schedule.setExecutionTime(now().plus(Duration.ofMillis(schedule.getOriginalDurationMs())));
    }
    if (resetTimer) {
      schedule.setExecuted(false);
    }

    boolean selectionChanged = request.entrySelection() != null;
    if (request.entriesData() != null || selectionChanged) {
      EntrySelection selection =
          selectionChanged ? toSelection(request.entrySelection()) : schedule.getEntrySelection();
      List<JournalEntry> entries;
      if (request.entriesData() != null) {
        if (request.passphrase() == null || request.passphrase().isBlank()) {
          throw new IllegalArgumentException("passphrase is required when replacing entries_data");
        }
        entries = request.entriesData();
        EntrySnapshotService.SealedSnapshot sealed = snapshots.seal(entries, request.passphrase());
        schedule.setEncryptedPayload(sealed.encryptedPayload());
        schedule.setKeyCustody(sealed.keyCustody());
      } else {
        entries = openForUpdate(schedule, request.passphrase());
      }
      schedule.setEntryCount(countMatching(selection, entries));
      schedule.applyEntrySelection(selection);
    }

    if (request.recipients() != null) {
      schedule.replaceRecipients(toRecipients(request.recipients()));
    }
  }

  private List<JournalEntry> openForUpdate(Schedule schedule, String passphrase) {
    try {
      return snapshots.open(
          schedule, passphrase == null || passphrase.isBlank() ? null : passphrase.toCharArray());
    } catch (DecryptionException e) {
      throw new IllegalArgumentException(
          "Stored entries could not be decrypted with the given passphrase", e);
    }
  }

  private int countMatching(EntrySelection selection, List<JournalEntry> entries) {
    int count = selection.apply(entries).size();
    if (count == 0) {
      throw new IllegalArgumentException("No entries match the selection criteria");
    }
    return count;
  }

  static long resolveDelay(Long durationMs, ExecutionDelay delay) {
    long millis;
    if (durationMs != null) {
      millis = durationMs;
    } else if (delay != null) {
      millis = delay.toMillis();
    } else {
      throw new IllegalArgumentException("An execution delay (duration_ms or delay) is required");
    }
    if (millis <= 0) {
      throw new IllegalArgumentException("Execution delay must be greater than zero");
    }
    if (millis > ExecutionDelay.MAX_MILLIS) {
      throw new IllegalArgumentException("Execution delay may not exceed 100 years");
    }
    return millis;
  }

  private static EntrySelection toSelection(EntrySelectionDto dto) {
    return dto == null || dto.type() == null ? EntrySelection.all() : dto.toSelection();
  }

  static List<ScheduleRecipient> toRecipients(List<RecipientRequest> requests) {
    if (requests == null || requests.isEmpty()) {
      throw new IllegalArgumentException("At least one recipient is required");
    }
    List<ScheduleRecipient> recipients = new ArrayList<>(requests.size());
    for (RecipientRequest request : requests) {
      String address = request.address().trim();
      if (request.channel() == DeliveryChannel.EMAIL) {
        if (!EMAIL.matcher(address).matches()) {
          throw new IllegalArgumentException("Invalid email address: " + address);
        }
      } else {
        address = address.replaceAll("[\\s().-]", "");
        if (!PHONE.matcher(address).matches()) {
          throw new IllegalArgumentException("Invalid phone number: " + request.address());
        }
      }
      recipients.add(new ScheduleRecipient(request.channel(), address));
    }
    return recipients;
  }

  private static String nameOrDefault(String name) {
    return name == null || name.isBlank() ? DEFAULT_NAME : name.trim();
  }

  private LocalDateTime now() {
    return LocalDateTime.now(clock);
  }
}
