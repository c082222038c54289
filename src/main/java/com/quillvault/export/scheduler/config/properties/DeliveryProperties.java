package com.quillvault.export.scheduler.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "export-scheduler.delivery")
public class DeliveryProperties {
  private long timeoutMs = 30000;
  private int poolSize = 8;

  /** When set, a single failed recipient fails the whole attempt. */
  private boolean requireAllRecipients;

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long v) {
    this.timeoutMs = v;
  }

  public int getPoolSize() {
    return poolSize;
  }

  public void setPoolSize(int v) {
    this.poolSize = v;
  }

  public boolean isRequireAllRecipients() {
    return requireAllRecipients;
  }

  public void setRequireAllRecipients(boolean v) {
    this.requireAllRecipients = v;
  }
}
