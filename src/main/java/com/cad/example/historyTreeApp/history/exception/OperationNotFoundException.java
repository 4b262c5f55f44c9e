package com.cad.example.historyTreeApp.history.exception;

import com.cad.example.historyTreeApp.history.operation.OperationId;
import lombok.Getter;

/**
 * Thrown when an operation id is not part of the tree.
 */
@Getter
public class OperationNotFoundException extends HistoryException {
  public static final String ERROR_CODE = "NOT_FOUND";

  private final OperationId operationId;

  public OperationNotFoundException(final OperationId operationId) {
    super(ERROR_CODE, String.format("Operation %s not found", operationId));
    this.operationId = operationId;
  }
}
