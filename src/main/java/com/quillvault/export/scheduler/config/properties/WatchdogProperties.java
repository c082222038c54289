package com.quillvault.export.scheduler.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "export-scheduler.watchdog")
public class WatchdogProperties {
  private long checkIntervalMs = 60000;
  private int staleClaimMinutes = 30;

  public long getCheckIntervalMs() {
    return checkIntervalMs;
  }

  public void setCheckIntervalMs(long v) {
    this.checkIntervalMs = v;
  }

  public int getStaleClaimMinutes() {
    return staleClaimMinutes;
  }

  public void setStaleClaimMinutes(int v) {
    this.staleClaimMinutes = v;
  }
}
