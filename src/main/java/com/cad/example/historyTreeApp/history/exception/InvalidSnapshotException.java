package com.cad.example.historyTreeApp.history.exception;

/**
 * Thrown when a snapshot does not describe a well formed history tree.
 */
public class InvalidSnapshotException extends HistoryException {
  public static final String ERROR_CODE = "INVALID_SNAPSHOT";

  public InvalidSnapshotException(final String reason) {
    super(ERROR_CODE, "Invalid history snapshot: " + reason);
  }
}
