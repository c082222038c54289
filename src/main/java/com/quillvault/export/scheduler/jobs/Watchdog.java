package com.quillvault.export.scheduler.jobs;

import com.quillvault.export.scheduler.config.properties.WatchdogProperties;
import com.quillvault.export.scheduler.exception.StoreUnavailableException;
import com.quillvault.export.scheduler.service.ScheduleStore;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Recovers claims left behind by a crashed or killed worker.
 *
 * <p>A schedule claimed longer ago than the threshold and not in flight in this process gets its
 * orphaned running log failed and its claim released, so the next trigger tick runs it again.
 */
@Component
public class Watchdog {
  private static final Logger log = LoggerFactory.getLogger(Watchdog.class);

  private final ScheduleStore store;
  private final ExecutionWorkerPool workerPool;
  private final Clock clock;
  private final int staleClaimMinutes;

  public Watchdog(
      ScheduleStore store, ExecutionWorkerPool workerPool, Clock clock, WatchdogProperties props) {
    this.store = store;
    this.workerPool = workerPool;
    this.clock = clock;
    this.staleClaimMinutes = props.getStaleClaimMinutes();
  }

  @Scheduled(
      fixedRateString = "${export-scheduler.watchdog.check-interval-ms:60000}",
      initialDelayString = "${export-scheduler.watchdog.check-interval-ms:60000}")
  public void runWatchdogCycle() {
    try {
      WatchdogResult result = recoverStaleClaims();
      if (result.recovered() > 0) {
        log.warn(
            "Watchdog released {} stale claim(s) older than {} minutes (took {}ms)",
            result.recovered(),
            staleClaimMinutes,
            result.durationMs());
      }
    } catch (StoreUnavailableException e) {
      log.warn("Watchdog skipped: {}", e.getMessage());
    }
  }

  public WatchdogResult recoverStaleClaims() {
    long startTime = System.currentTimeMillis();
    LocalDateTime now = LocalDateTime.now(clock);
    LocalDateTime threshold = now.minusMinutes(staleClaimMinutes);

    List<UUID> stale = store.findStaleClaims(threshold);
    int recovered = 0;
    int skipped = 0;
    for (UUID scheduleId : stale) {
      if (workerPool.isInFlight(scheduleId)) {
        // alive; the attempt is bounded by the execution timeout and closes its own log
        skipped++;
        continue;
      }
      String message =
          "Execution abandoned: no result within " + staleClaimMinutes + " minutes of claiming";
      if (store.abandonStaleClaim(scheduleId, threshold, now, message)) {
        recovered++;
        log.warn("Released stale claim of schedule {} claimed before {}", scheduleId, threshold);
      }
    }
    return new WatchdogResult(recovered, skipped, System.currentTimeMillis() - startTime);
  }

  public record WatchdogResult(int recovered, int skippedInFlight, long durationMs) { }
}
