package com.cad.example.historyTreeApp.history.exception;

import com.cad.example.historyTreeApp.history.operation.OperationId;
import lombok.Getter;

/**
 * Thrown when a branch name is registered twice.
 */
@Getter
public class DuplicateBranchException extends HistoryException {
  public static final String ERROR_CODE = "DUPLICATE_BRANCH";

  private final String branchName;
  private final OperationId existingTarget;

  public DuplicateBranchException(final String branchName, final OperationId existingTarget) {
    super(ERROR_CODE, String.format("Branch '%s' already exists: %s", branchName, existingTarget));
    this.branchName = branchName;
    this.existingTarget = existingTarget;
  }
}
