package com.quillvault.export.scheduler.metrics;

import com.quillvault.export.scheduler.model.ExecutionStatus;
import com.quillvault.export.scheduler.model.ExecutionTrigger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import org.springframework.stereotype.Component;

/**
 * Process-wide execution counters. Outcomes are published to Micrometer and also kept as plain
 * totals so the health endpoints can compute a failure rate without querying the registry.
 */
@Component
public class ExecutionMetrics {

  private final MeterRegistry meterRegistry;
  private final Map<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
  private final Timer executionTimer;

  private final LongAdder successful = new LongAdder();
  private final LongAdder failed = new LongAdder();
  private final LongAdder totalDurationMs = new LongAdder();
  private final AtomicLong lastDurationMs = new AtomicLong(-1);

  public ExecutionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.executionTimer =
        Timer.builder("export.execution.duration")
            .description("Wall time of one export attempt, decrypt through delivery")
            .register(meterRegistry);
  }

  public void recordExecution(ExecutionTrigger trigger, ExecutionStatus status, Duration took) {
    outcomeCounter(trigger, status).increment();
    executionTimer.record(took);

    if (status == ExecutionStatus.SUCCESS) {
      successful.increment();
    } else {
      failed.increment();
    }
    totalDurationMs.add(took.toMillis());
    lastDurationMs.set(took.toMillis());
  }

  public ExecutionStats snapshot() {
    long ok = successful.sum();
    long bad = failed.sum();
    long total = ok + bad;
    long last = lastDurationMs.get();
    return new ExecutionStats(
        total,
        ok,
        bad,
        last < 0 ? null : last,
        total == 0 ? 0.0 : (double) totalDurationMs.sum() / total,
        total == 0 ? 0.0 : (double) bad / total);
  }

  private Counter outcomeCounter(ExecutionTrigger trigger, ExecutionStatus status) {
    String key = trigger.name() + ":" + status.name();
    return outcomeCounters.computeIfAbsent(
        key,
        k ->
            Counter.builder("export.executions")
                .tag("trigger", trigger.wireName())
                .tag("outcome", status.wireName())
                .description("Completed export attempts")
                .register(meterRegistry));
  }

  /** Totals since start; {@code failureRate} is 0 when nothing has run yet. */
  public record ExecutionStats(
      long totalExecutions,
      long successfulExecutions,
      long failedExecutions,
      Long lastExecutionMs,
      double averageExecutionMs,
      double failureRate) {}
}
