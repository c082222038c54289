package com.quillvault.export.scheduler.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "export-scheduler.execution")
public class ExecutionProperties {
  /** Upper bound for one whole attempt, decrypt through delivery. */
  private long timeoutMs = 300000;

  private long renderTimeoutMs = 120000;

  // failure-rate thresholds for the execution health indicator
  private double degradedFailureRate = 0.2;
  private double unhealthyFailureRate = 0.5;

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long v) {
    this.timeoutMs = v;
  }

  public long getRenderTimeoutMs() {
    return renderTimeoutMs;
  }

  public void setRenderTimeoutMs(long v) {
    this.renderTimeoutMs = v;
  }

  public double getDegradedFailureRate() {
    return degradedFailureRate;
  }

  public void setDegradedFailureRate(double v) {
    this.degradedFailureRate = v;
  }

  public double getUnhealthyFailureRate() {
    return unhealthyFailureRate;
  }

  public void setUnhealthyFailureRate(double v) {
    this.unhealthyFailureRate = v;
  }
}
