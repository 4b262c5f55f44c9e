package com.cad.example.historyTreeApp.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time statistics of a history tree.
 */
@Value
@Builder
@AllArgsConstructor
public class HistoryStats {
  public static final HistoryStats EMPTY = HistoryStats.builder().build();

  // successful addOperation calls, compression does not decrease it
  int totalOperations;
  int nodeCount;
  int currentDepth;
  int branchCount;
  int compressionSavings;
  // null until the first operation is added
  Instant lastOperationTime;
}
