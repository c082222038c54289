package com.quillvault.export.scheduler.config.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.quillvault.export.scheduler.config.properties.ExecutionProperties;
import com.quillvault.export.scheduler.metrics.ExecutionMetrics;
import com.quillvault.export.scheduler.model.ExecutionStatus;
import com.quillvault.export.scheduler.model.ExecutionTrigger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

class ExecutionHealthIndicatorTest {

  private ExecutionMetrics metrics;
  private ExecutionHealthIndicator indicator;

  @BeforeEach
  void setUp() {
    metrics = new ExecutionMetrics(new SimpleMeterRegistry());
    indicator = new ExecutionHealthIndicator(metrics, new ExecutionProperties());
  }

  @Test
  void upBeforeAnythingRuns() {
    Health health = indicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails()).containsEntry("totalExecutions", 0L);
    assertThat(health.getDetails()).doesNotContainKey("lastExecutionMs");
  }

  @Test
  void twentyPercentFailuresIsStillUp() {
    record(4, 1);

    assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
  }

  @Test
  void degradedAboveTwentyPercent() {
    record(3, 1);

    Health health = indicator.health();
    assertThat(health.getStatus()).isEqualTo(ExecutionHealthIndicator.DEGRADED);
    assertThat(health.getDetails()).containsEntry("failedExecutions", 1L);
    assertThat(health.getDetails()).containsEntry("failureRate", 0.25);
  }

  @Test
  void downAboveHalf() {
    record(1, 2);

    assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
  }

  @Test
  void snapshotAveragesDurations() {
    metrics.recordExecution(
        ExecutionTrigger.MANUAL, ExecutionStatus.SUCCESS, Duration.ofMillis(100));
    metrics.recordExecution(
        ExecutionTrigger.AUTOMATIC, ExecutionStatus.FAILED, Duration.ofMillis(300));

    ExecutionMetrics.ExecutionStats stats = metrics.snapshot();
    assertThat(stats.averageExecutionMs()).isEqualTo(200.0);
    assertThat(stats.lastExecutionMs()).isEqualTo(300L);
    assertThat(stats.failureRate()).isEqualTo(0.5);
  }

  private void record(int succeeded, int failed) {
    for (int i = 0; i < succeeded; i++) {
      metrics.recordExecution(
          ExecutionTrigger.AUTOMATIC, ExecutionStatus.SUCCESS, Duration.ofMillis(50));
    }
    for (int i = 0; i < failed; i++) {
      metrics.recordExecution(
          ExecutionTrigger.AUTOMATIC, ExecutionStatus.FAILED, Duration.ofMillis(50));
    }
  }
}
