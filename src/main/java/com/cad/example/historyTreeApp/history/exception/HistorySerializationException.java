package com.cad.example.historyTreeApp.history.exception;

public class HistorySerializationException extends HistoryException {
  public static final String ERROR_CODE = "SERIALIZATION_FAILED";

  public HistorySerializationException(final String message, final Throwable cause) {
    super(ERROR_CODE, message, cause);
  }
}
