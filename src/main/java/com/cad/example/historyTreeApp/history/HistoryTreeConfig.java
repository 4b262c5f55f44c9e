package com.cad.example.historyTreeApp.history;

import com.cad.example.historyTreeApp.history.operation.OperationFactory;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HistoryTreeConfig {
  public static final int DEFAULT_MAX_OPERATIONS = 1000;

  /**
   * Node count at which {@link HistoryTree#addOperation} compresses the tree before inserting.
   */
  @Builder.Default
  int maxOperations = DEFAULT_MAX_OPERATIONS;

  @Builder.Default
  boolean autoCompress = true;

  /**
   * Issues the ids of operations produced by compression.
   */
  @Builder.Default
  OperationFactory operationFactory = OperationFactory.getDefault();

  public static HistoryTreeConfig defaults() {
    return HistoryTreeConfig.builder().build();
  }

  public static HistoryTreeConfig withMaxOperations(final int maxOperations) {
    return HistoryTreeConfig.builder().maxOperations(maxOperations).build();
  }
}
