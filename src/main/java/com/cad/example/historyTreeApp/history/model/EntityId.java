package com.cad.example.historyTreeApp.history.model;

import lombok.Value;

/**
 * Reference to a drawing entity. The generation distinguishes versions of the same id
 * that reappear through undo/redo.
 */
@Value
public class EntityId {
  long id;
  int generation;

  public static EntityId of(final long id) {
    return new EntityId(id, 0);
  }
}
