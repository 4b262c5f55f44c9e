package com.cad.example.historyTreeApp.history;

import com.cad.example.historyTreeApp.history.operation.Operation;
import com.cad.example.historyTreeApp.history.operation.OperationId;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@RequiredArgsConstructor
@AllArgsConstructor(onConstructor_ = @JsonCreator)
public final class HistoryNode {
  private final Operation operation;
  private OperationId parent;
  private List<OperationId> children = new ArrayList<>();
  private int depth;
  private boolean active;

  public HistoryNode(final Operation operation, final OperationId parent, final int depth) {
    this(operation);
    this.parent = parent;
    this.depth = depth;
  }

  @JsonIgnore
  public OperationId getId() {
    return operation.getId();
  }

  @JsonIgnore
  public boolean isRoot() {
    return parent == null;
  }

  /**
   * More than one child: the history forks here.
   */
  @JsonIgnore
  public boolean isBranchPoint() {
    return children.size() > 1;
  }

  public void addChild(final OperationId childId) {
    children.add(childId);
  }

  public void replaceChild(final OperationId oldId, final OperationId newId) {
    children.set(children.indexOf(oldId), newId);
  }

  /**
   * Same node under another operation, used when compression swaps in a merged operation.
   */
  public HistoryNode withOperation(final Operation replacement) {
    return new HistoryNode(replacement, parent, new ArrayList<>(children), depth, active);
  }

  public HistoryNode copy() {
    return new HistoryNode(operation, parent, new ArrayList<>(children), depth, active);
  }
}
