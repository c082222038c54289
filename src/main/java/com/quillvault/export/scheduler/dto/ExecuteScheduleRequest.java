package com.quillvault.export.scheduler.dto;

/** Optional body of an "execute now" call. */
public record ExecuteScheduleRequest(String passphrase) {

  @Override
  public String toString() {
    return "ExecuteScheduleRequest[passphrase=" + (passphrase == null ? "absent" : "****") + "]";
  }
}
