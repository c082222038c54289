package com.quillvault.export.scheduler.config.health;

import com.quillvault.export.scheduler.config.properties.TriggerLoopProperties;
import com.quillvault.export.scheduler.jobs.ExecutionWorkerPool;
import com.quillvault.export.scheduler.jobs.TriggerLoop;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class TriggerLoopHealthIndicator implements HealthIndicator {
  private static final int MISSED_TICKS_TOLERATED = 3;

  private final TriggerLoop triggerLoop;
  private final ExecutionWorkerPool workerPool;
  private final TriggerLoopProperties props;
  private final Clock clock;

  public TriggerLoopHealthIndicator(
      TriggerLoop triggerLoop,
      ExecutionWorkerPool workerPool,
      TriggerLoopProperties props,
      Clock clock) {
    this.triggerLoop = triggerLoop;
    this.workerPool = workerPool;
    this.props = props;
    this.clock = clock;
  }

  @Override
  public Health health() {
    if (!props.isEnabled()) {
      return Health.up().withDetail("triggerLoop", "disabled").build();
    }
    Instant lastTick = triggerLoop.getLastTickAt();
    Health.Builder builder =
        triggerLoop.isRunning() ? Health.up() : Health.down().withDetail("triggerLoop", "stopped");
    if (lastTick != null) {
      Duration sinceTick = Duration.between(lastTick, Instant.now(clock));
      if (sinceTick.toMillis() > props.getTickIntervalMs() * MISSED_TICKS_TOLERATED) {
        builder = Health.down().withDetail("triggerLoop", "stalled");
      }
      builder.withDetail("lastTickAt", lastTick.toString());
    }
    if (triggerLoop.getLastError() != null) {
      builder.withDetail("lastError", triggerLoop.getLastError());
    }
    return builder.withDetail("activeExecutions", workerPool.activeCount()).build();
  }
}
