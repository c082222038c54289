package com.quillvault.export.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.quillvault.export.scheduler.model.EntrySelection;
import com.quillvault.export.scheduler.model.EntrySelectionType;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EntrySelectionDto(
    @NotNull EntrySelectionType type,
    @JsonProperty("entry_ids") List<String> entryIds,
    @JsonProperty("date_range_start") Long dateRangeStart,
    @JsonProperty("date_range_end") Long dateRangeEnd) {

  public EntrySelection toSelection() {
    switch (type) {
      case SPECIFIC:
        if (entryIds == null || entryIds.isEmpty()) {
          throw new IllegalArgumentException("entry_ids is required for a specific selection");
        }
        return new EntrySelection.Specific(new LinkedHashSet<>(entryIds));
      case DATE_RANGE:
        if (dateRangeStart == null || dateRangeEnd == null) {
          throw new IllegalArgumentException(
              "date_range_start and date_range_end are required for a date range selection");
        }
        return new EntrySelection.DateRange(dateRangeStart, dateRangeEnd);
      default:
        return EntrySelection.all();
    }
  }

  public static EntrySelectionDto from(EntrySelection selection) {
    if (selection instanceof EntrySelection.Specific) {
      return new EntrySelectionDto(
          EntrySelectionType.SPECIFIC,
          new ArrayList<>(((EntrySelection.Specific) selection).ids()),
          null,
          null);
    }
    if (selection instanceof EntrySelection.DateRange) {
      EntrySelection.DateRange range = (EntrySelection.DateRange) selection;
      return new EntrySelectionDto(
          EntrySelectionType.DATE_RANGE, null, range.start(), range.end());
    }
    return new EntrySelectionDto(EntrySelectionType.ALL, null, null, null);
  }
}
