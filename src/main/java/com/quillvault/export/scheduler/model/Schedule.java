package com.quillvault.export.scheduler.model;

import com.quillvault.export.scheduler.config.ClockAwareEntityListener;
import jakarta.persistence.CascadeType;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "schedules")
@EntityListeners(ClockAwareEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
public class Schedule {

  @Version
  @Column(name = "version")
  private Long version;

  @Id
  @Column(name = "schedule_id", columnDefinition = "uuid")
  private UUID id;

  @Column(name = "owner_id", nullable = false, columnDefinition = "uuid")
  private UUID ownerId;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "execution_time", nullable = false)
  private LocalDateTime executionTime;

  @Column(name = "original_duration_ms", nullable = false)
  private long originalDurationMs;

  @Enumerated(EnumType.STRING)
  @Column(name = "selection_type", nullable = false)
  private EntrySelectionType selectionType = EntrySelectionType.ALL;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "schedule_entry_ids", joinColumns = @JoinColumn(name = "schedule_id"))
  @Column(name = "entry_id", nullable = false)
  private Set<String> entryIds = new LinkedHashSet<>();

  @Column(name = "date_range_start")
  private Long dateRangeStart;

  @Column(name = "date_range_end")
  private Long dateRangeEnd;

  /** Sealed snapshot envelope; never contains the passphrase. */
  @Column(name = "encrypted_payload", nullable = false, columnDefinition = "text")
  private String encryptedPayload;

  /** Passphrase-derived key wrapped under the server custody key. */
  @Column(name = "key_custody", nullable = false, columnDefinition = "text")
  private String keyCustody;

  @Column(name = "entry_count", nullable = false)
  private int entryCount;

  @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
  @JoinColumn(name = "schedule_id", nullable = false)
  @OrderBy("position ASC")
  private List<ScheduleRecipient> recipients = new ArrayList<>();

  @Column(name = "executed", nullable = false)
  private boolean executed = false;

  @Column(name = "executed_at")
  private LocalDateTime executedAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "claim_state", nullable = false)
  private ClaimState claimState = ClaimState.IDLE;

  @Column(name = "claimed_at")
  private LocalDateTime claimedAt;

  @Column(name = "deletion_requested", nullable = false)
  private boolean deletionRequested = false;

  @Column(name = "created_at", nullable = false)
  private LocalDateTime createdAt;

  @Column(name = "updated_at", nullable = false)
  private LocalDateTime updatedAt;

  public EntrySelection getEntrySelection() {
    switch (selectionType) {
      case SPECIFIC:
        return new EntrySelection.Specific(entryIds);
      case DATE_RANGE:
        return new EntrySelection.DateRange(dateRangeStart, dateRangeEnd);
      default:
        return EntrySelection.all();
    }
  }

  public void applyEntrySelection(EntrySelection selection) {
    this.selectionType = selection.type();
    this.entryIds.clear();
    this.dateRangeStart = null;
    this.dateRangeEnd = null;
    if (selection instanceof EntrySelection.Specific) {
      this.entryIds.addAll(((EntrySelection.Specific) selection).ids());
    } else if (selection instanceof EntrySelection.DateRange) {
      EntrySelection.DateRange range = (EntrySelection.DateRange) selection;
      this.dateRangeStart = range.start();
      this.dateRangeEnd = range.end();
    }
  }

  public void replaceRecipients(List<ScheduleRecipient> replacement) {
    this.recipients.clear();
    int position = 0;
    for (ScheduleRecipient recipient : replacement) {
      recipient.setPosition(position++);
      this.recipients.add(recipient);
    }
  }

  public boolean isRunning() {
    return claimState == ClaimState.RUNNING;
  }
}
