package com.quillvault.export.scheduler.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Which entries of the snapshot an execution exports. */
public interface EntrySelection {

  EntrySelectionType type();

  List<JournalEntry> apply(List<JournalEntry> entries);

  static EntrySelection all() {
    return new All();
  }

  record All() implements EntrySelection {
    @Override
    public EntrySelectionType type() {
      return EntrySelectionType.ALL;
    }

    @Override
    public List<JournalEntry> apply(List<JournalEntry> entries) {
      return List.copyOf(entries);
    }
  }

  record Specific(Set<String> ids) implements EntrySelection {
    public Specific {
      if (ids == null || ids.isEmpty()) {
        throw new IllegalArgumentException("Specific entry selection requires at least one entry id");
      }
      ids = new LinkedHashSet<>(ids);
    }

    @Override
    public EntrySelectionType type() {
      return EntrySelectionType.SPECIFIC;
    }

    @Override
    public List<JournalEntry> apply(List<JournalEntry> entries) {
      return entries.stream().filter(e -> ids.contains(e.id())).collect(Collectors.toList());
    }
  }

  /** Inclusive on both ends, in epoch milliseconds. */
  record DateRange(long start, long end) implements EntrySelection {
    public DateRange {
      if (end < start) {
        throw new IllegalArgumentException("Date range end must not be before its start");
      }
    }

    @Override
    public EntrySelectionType type() {
      return EntrySelectionType.DATE_RANGE;
    }

    @Override
    public List<JournalEntry> apply(List<JournalEntry> entries) {
      return entries.stream()
          .filter(e -> e.createdAt() != null)
          .filter(e -> e.createdAt() >= start && e.createdAt() <= end)
          .collect(Collectors.toList());
    }
  }
}
