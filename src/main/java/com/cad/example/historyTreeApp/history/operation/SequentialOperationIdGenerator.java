package com.cad.example.historyTreeApp.history.operation;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counter based generator, starts at 1. Thread safe.
 */
public class SequentialOperationIdGenerator implements OperationIdGenerator {
  static final SequentialOperationIdGenerator GLOBAL = new SequentialOperationIdGenerator();

  private final AtomicLong lastIssued = new AtomicLong(0L);

  @Override
  public OperationId next() {
    return OperationId.of(lastIssued.incrementAndGet());
  }

  @Override
  public void advancePast(final OperationId id) {
    lastIssued.accumulateAndGet(id.getValue(), Math::max);
  }

  public void reset() {
    lastIssued.set(0L);
  }
}
