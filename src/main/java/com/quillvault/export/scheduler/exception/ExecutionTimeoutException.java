package com.quillvault.export.scheduler.exception;

/** An attempt, or one of its stages, ran past its time budget. */
public class ExecutionTimeoutException extends RuntimeException {

  public ExecutionTimeoutException(String message) {
    super(message);
  }
}
