package com.quillvault.export.scheduler.config.health;

import com.quillvault.export.scheduler.config.properties.ExecutionProperties;
import com.quillvault.export.scheduler.metrics.ExecutionMetrics;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/** Reports DEGRADED or DOWN once the share of failed export attempts crosses its threshold. */
@Component
public class ExecutionHealthIndicator implements HealthIndicator {
  public static final Status DEGRADED = new Status("DEGRADED", "Export failure rate is elevated");

  private final ExecutionMetrics metrics;
  private final ExecutionProperties props;

  public ExecutionHealthIndicator(ExecutionMetrics metrics, ExecutionProperties props) {
    this.metrics = metrics;
    this.props = props;
  }

  @Override
  public Health health() {
    ExecutionMetrics.ExecutionStats stats = metrics.snapshot();
    Health.Builder builder;
    if (stats.totalExecutions() > 0 && stats.failureRate() > props.getUnhealthyFailureRate()) {
      builder = Health.down();
    } else if (stats.totalExecutions() > 0
        && stats.failureRate() > props.getDegradedFailureRate()) {
      builder = Health.status(DEGRADED);
    } else {
      builder = Health.up();
    }
    builder
        .withDetail("totalExecutions", stats.totalExecutions())
        .withDetail("successfulExecutions", stats.successfulExecutions())
        .withDetail("failedExecutions", stats.failedExecutions())
        .withDetail("failureRate", stats.failureRate())
        .withDetail("averageExecutionMs", stats.averageExecutionMs());
    if (stats.lastExecutionMs() != null) {
      builder.withDetail("lastExecutionMs", stats.lastExecutionMs());
    }
    return builder.build();
  }
}
