package com.quillvault.export.scheduler.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One journal entry of the snapshot captured when a schedule is created. {@code content} is the
 * editor's HTML; timestamps are epoch milliseconds.
 */
public record JournalEntry(
    @NotBlank String id, String title, String content, @NotNull Long createdAt, Long updatedAt) {

  public String displayTitle() {
    return title == null || title.isBlank() ? "Untitled" : title;
  }
}
