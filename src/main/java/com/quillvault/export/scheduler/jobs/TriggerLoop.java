package com.quillvault.export.scheduler.jobs;

import com.quillvault.export.scheduler.config.properties.TriggerLoopProperties;
import com.quillvault.export.scheduler.exception.ExecutionRejectedException;
import com.quillvault.export.scheduler.exception.StoreUnavailableException;
import com.quillvault.export.scheduler.model.Schedule;
import com.quillvault.export.scheduler.service.ScheduleClaim;
import com.quillvault.export.scheduler.service.ScheduleStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Periodically claims due schedules and hands them to the worker pool.
 *
 * <p>The only state is the running ticker; {@link #start()} and {@link #stop()} are idempotent.
 * {@link #tick()} reads the injected clock, so tests drive it directly with a fixed one.
 */
@Component
public class TriggerLoop implements SmartLifecycle {
  private static final Logger log = LoggerFactory.getLogger(TriggerLoop.class);

  private final ScheduleStore store;
  private final ExecutionWorkerPool workerPool;
  private final TaskScheduler taskScheduler;
  private final Clock clock;
  private final TriggerLoopProperties props;

  private final AtomicReference<ScheduledFuture<?>> ticker = new AtomicReference<>();
  private volatile Instant lastTickAt;
  private volatile String lastError;

  public TriggerLoop(
      ScheduleStore store,
      ExecutionWorkerPool workerPool,
      @Qualifier("triggerScheduler") TaskScheduler taskScheduler,
      Clock clock,
      TriggerLoopProperties props) {
    this.store = store;
    this.workerPool = workerPool;
    this.taskScheduler = taskScheduler;
    this.clock = clock;
    this.props = props;
  }

  @Override
  public synchronized void start() {
    if (!props.isEnabled()) {
      log.info("Trigger loop disabled by configuration");
      return;
    }
    if (ticker.get() != null) {
      return;
    }
    ticker.set(
        taskScheduler.scheduleAtFixedRate(this::tick, Duration.ofMillis(props.getTickIntervalMs())));
    log.info("Trigger loop started, polling every {}ms", props.getTickIntervalMs());
  }

  @Override
  public synchronized void stop() {
    ScheduledFuture<?> current = ticker.getAndSet(null);
    if (current != null) {
      current.cancel(false);
      log.info("Trigger loop stopped");
    }
  }

  @Override
  public boolean isRunning() {
    return ticker.get() != null;
  }

  /**
   * Claims due schedules while the pool has room.
   *
   * @return how many schedules were handed off
   */
  public int tick() {
    int dispatched = 0;
    try {
      while (workerPool.hasCapacity()) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<Schedule> claimed = store.claimDue(now);
        if (claimed.isEmpty()) {
          break;
        }
        workerPool.submit(ScheduleClaim.automatic(claimed.get().getId()));
        dispatched++;
      }
      lastError = null;
    } catch (StoreUnavailableException e) {
      lastError = e.getMessage();
      log.warn("Schedule store unavailable, retrying next tick: {}", e.getMessage());
    } catch (ExecutionRejectedException e) {
      lastError = e.getMessage();
      log.warn("Worker pool rejected a claimed schedule: {}", e.getMessage());
    } catch (RuntimeException e) {
      lastError = e.getMessage();
      log.error("Unexpected error in trigger loop tick", e);
    } finally {
      lastTickAt = clock.instant();
    }
    if (dispatched > 0) {
      log.info("Trigger loop dispatched {} due schedule(s)", dispatched);
    }
    return dispatched;
  }

  public Instant getLastTickAt() {
    return lastTickAt;
  }

  public String getLastError() {
    return lastError;
  }
}
