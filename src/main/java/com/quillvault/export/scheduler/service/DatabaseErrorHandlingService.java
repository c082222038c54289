package com.quillvault.export.scheduler.service;

import com.quillvault.export.scheduler.exception.StoreUnavailableException;
import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Classifies persistence failures. Connectivity and other transient failures surface as {@link
 * StoreUnavailableException}; anything else is rethrown unchanged.
 */
@Service
public class DatabaseErrorHandlingService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseErrorHandlingService.class);

  /** Wraps transient failures, returns any other exception as-is for the caller to throw. */
  public RuntimeException translate(String operation, RuntimeException error) {
    ErrorType type = classifyError(error);
    if (type == ErrorType.UNAVAILABLE) {
      log.warn("Schedule store unavailable during {}: {}", operation, error.getMessage());
      return new StoreUnavailableException(
          "Schedule store is temporarily unavailable, please retry", error);
    }
    if (type == ErrorType.FATAL) {
      log.error("Fatal database error during {}", operation, error);
    }
    return error;
  }

  public ErrorType classifyError(Throwable error) {
    if (isFatalError(error)) {
      return ErrorType.FATAL;
    } else if (isUnavailableError(error)) {
      return ErrorType.UNAVAILABLE;
    }
    return ErrorType.UNKNOWN;
  }

  /** Walks the cause chain looking for a transient condition. */
  public boolean isUnavailableError(Throwable error) {
    Throwable cause = error;
    while (cause != null) {
      if (isUnavailableException(cause)) {
        return true;
      }
      cause = cause.getCause();
    }
    return false;
  }

  private boolean isUnavailableException(Throwable exception) {
    if (exception instanceof CannotCreateTransactionException
        || exception instanceof DataAccessResourceFailureException) {
      return true;
    }

    if (exception instanceof TransientDataAccessException
        || exception instanceof QueryTimeoutException) {
      log.debug("Detected transient data access exception: {}", exception.getMessage());
      return true;
    }

    if (exception instanceof SQLException) {
      SQLException sqlEx = (SQLException) exception;
      if (isPostgreSQLTransientState(sqlEx.getSQLState())) {
        log.debug("Detected transient SQL state {}", sqlEx.getSQLState());
        return true;
      }
    }

    // Connection pool exhaustion or similar
    if (exception.getMessage() != null) {
      String message = exception.getMessage().toLowerCase();
      if (message.contains("connection")
          && (message.contains("timeout")
              || message.contains("pool")
              || message.contains("refused"))) {
        return true;
      }
    }

    return false;
  }

  private boolean isPostgreSQLTransientState(String sqlState) {
    if (sqlState == null) {
      return false;
    }
    // Connection exceptions
    if (sqlState.startsWith("08")) {
      return true;
    }
    // Lock timeout
    if ("55P03".equals(sqlState)) {
      return true;
    }
    // Admin/crash shutdown, cannot connect now
    return "57P01".equals(sqlState) || "57P02".equals(sqlState) || "57P03".equals(sqlState);
  }

  public boolean isFatalError(Throwable error) {
    Throwable cause = error;
    while (cause != null) {
      if (cause instanceof DataIntegrityViolationException) {
        return true;
      }
      if (cause instanceof SQLException) {
        String sqlState = ((SQLException) cause).getSQLState();
        // Syntax errors, access violations, schema issues
        if (sqlState != null && (sqlState.startsWith("42") || sqlState.startsWith("2A"))) {
          return true;
        }
      }
      cause = cause.getCause();
    }
    return false;
  }

  public enum ErrorType {
    UNAVAILABLE,
    FATAL,
    UNKNOWN
  }
}
