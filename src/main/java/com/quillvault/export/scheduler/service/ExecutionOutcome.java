package com.quillvault.export.scheduler.service;

import com.quillvault.export.scheduler.model.ExecutionStatus;

/** Terminal result of one attempt, written to its execution log. */
public record ExecutionOutcome(
    ExecutionStatus status,
    int entryCount,
    int recipientsTotal,
    int recipientsSent,
    String errorMessage) {

  public static ExecutionOutcome failed(
      int entryCount, int recipientsTotal, int recipientsSent, String errorMessage) {
    return new ExecutionOutcome(
        ExecutionStatus.FAILED, entryCount, recipientsTotal, recipientsSent, errorMessage);
  }

  public boolean isSuccess() {
    return status == ExecutionStatus.SUCCESS;
  }
}
