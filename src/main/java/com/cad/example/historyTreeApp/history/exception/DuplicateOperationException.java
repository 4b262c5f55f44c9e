package com.cad.example.historyTreeApp.history.exception;

import com.cad.example.historyTreeApp.history.operation.OperationId;
import lombok.Getter;

/**
 * Thrown when an operation id is already in the tree, or is the null id.
 */
@Getter
public class DuplicateOperationException extends HistoryException {
  public static final String ERROR_CODE = "DUPLICATE_OPERATION";

  private final OperationId operationId;

  public DuplicateOperationException(final OperationId operationId) {
    super(ERROR_CODE, String.format("Operation %s can not be added twice", operationId));
    this.operationId = operationId;
  }
}
