package com.quillvault.export.scheduler.exception;

public class RenderException extends RuntimeException {

  public RenderException(String message, Throwable cause) {
    super(message, cause);
  }
}
