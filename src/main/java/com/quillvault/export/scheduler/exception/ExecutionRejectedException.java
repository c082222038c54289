package com.quillvault.export.scheduler.exception;

/** The execution worker pool is saturated and did not accept a claimed schedule. */
public class ExecutionRejectedException extends RuntimeException {

  public ExecutionRejectedException(String message, Throwable cause) {
    super(message, cause);
  }
}
