package com.cad.example.historyTreeApp.history.exception;

import lombok.Getter;

/**
 * Base exception for all history errors.
 */
@Getter
public class HistoryException extends RuntimeException {
  private final String errorCode;

  public HistoryException(final String errorCode, final String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public HistoryException(final String errorCode, final String message, final Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }
}
