package com.quillvault.export.scheduler.model;

/** Processing marker written by the atomic claim; RUNNING means an attempt owns the schedule. */
public enum ClaimState {
  IDLE,
  RUNNING
}
