package com.cad.example.historyTreeApp.history.operation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Identifier of an operation. Ids are issued once by an {@link OperationIdGenerator} and never reused.
 * {@link #NULL} means "no operation" and is never stored in a history tree.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationId implements Comparable<OperationId> {
  public static final OperationId NULL = new OperationId(0L);

  @JsonValue
  long value;

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static OperationId of(final long value) {
    return value == 0L ? NULL : new OperationId(value);
  }

  public boolean isNull() {
    return value == 0L;
  }

  @Override
  public int compareTo(final OperationId other) {
    return Long.compare(value, other.value);
  }

  @Override
  public String toString() {
    return "#" + value;
  }
}
