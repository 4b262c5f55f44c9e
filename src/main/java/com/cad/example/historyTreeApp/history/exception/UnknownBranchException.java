package com.cad.example.historyTreeApp.history.exception;

import lombok.Getter;

@Getter
public class UnknownBranchException extends HistoryException {
  public static final String ERROR_CODE = "UNKNOWN_BRANCH";

  private final String branchName;

  public UnknownBranchException(final String branchName) {
    super(ERROR_CODE, String.format("Branch '%s' not found", branchName));
    this.branchName = branchName;
  }
}
