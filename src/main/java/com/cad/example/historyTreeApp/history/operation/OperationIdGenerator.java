package com.cad.example.historyTreeApp.history.operation;

/**
 * Source of fresh operation ids.
 */
public interface OperationIdGenerator {
  OperationId next();

  /**
   * Make sure ids issued from now on are greater than {@code id}.
   * Used after restoring a history whose ids were issued by another generator.
   */
  void advancePast(final OperationId id);

  static OperationIdGenerator global() {
    return SequentialOperationIdGenerator.GLOBAL;
  }
}
