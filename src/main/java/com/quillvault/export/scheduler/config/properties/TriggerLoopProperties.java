package com.quillvault.export.scheduler.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "export-scheduler.trigger")
public class TriggerLoopProperties {
  private boolean enabled = true;
  private long tickIntervalMs = 5000;
  private int workerPoolSize = 4;
  private int queueCapacity = 16;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean v) {
    this.enabled = v;
  }

  public long getTickIntervalMs() {
    return tickIntervalMs;
  }

  public void setTickIntervalMs(long v) {
    this.tickIntervalMs = v;
  }

  public int getWorkerPoolSize() {
    return workerPoolSize;
  }

  public void setWorkerPoolSize(int v) {
    this.workerPoolSize = v;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public void setQueueCapacity(int v) {
    this.queueCapacity = v;
  }
}
