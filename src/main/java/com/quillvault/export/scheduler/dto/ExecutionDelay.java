package com.quillvault.export.scheduler.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;

/** Delay from now until execution, as the settings screen composes it. Years are 365 days, months 30. */
public record ExecutionDelay(
    @Min(0) @Max(100) Integer years,
    @Min(0) @Max(1200) Integer months,
    @Min(0) @Max(5200) Integer weeks,
    @Min(0) @Max(36500) Integer days,
    @Min(0) @Max(876000) Integer hours,
    @Min(0) @Max(52560000) Integer minutes) {

  /** One hundred 365-day years. */
  public static final long MAX_MILLIS = 3_153_600_000_000L;

  public long toMillis() {
    long totalDays = 365L * value(years) + 30L * value(months) + 7L * value(weeks) + value(days);
    return Duration.ofDays(totalDays)
        .plusHours(value(hours))
        .plusMinutes(value(minutes))
        .toMillis();
  }

  private static long value(Integer part) {
    return part == null ? 0 : part;
  }
}
