package com.quillvault.export.scheduler.exception;

/** The schedule store could not be reached; callers may retry later. */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
