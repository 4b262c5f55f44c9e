package com.cad.example.historyTreeApp.history.serialization;

import com.cad.example.historyTreeApp.history.HistoryNode;
import com.cad.example.historyTreeApp.history.HistoryStats;
import com.cad.example.historyTreeApp.history.exception.InvalidSnapshotException;
import com.cad.example.historyTreeApp.history.operation.OperationId;
import lombok.Value;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything needed to rebuild a history tree: nodes, roots, current node, branches and statistics.
 * Undo and redo stacks are not part of it.
 */
@Value
public class HistoryTreeSnapshot {
  List<HistoryNode> nodes;
  List<OperationId> rootIds;
  // null when nothing is applied
  OperationId currentId;
  Map<String, OperationId> branches;
  HistoryStats stats;

  /**
   * @throws InvalidSnapshotException when links are not mutual, depths do not match, or roots,
   *                                  current node or branches point at missing nodes
   */
  public void validate() {
    if (nodes == null || rootIds == null || branches == null) {
      throw new InvalidSnapshotException("nodes, rootIds and branches are required");
    }

    Map<OperationId, HistoryNode> nodeMap = new HashMap<>();
    for (HistoryNode node : nodes) {
      if (node == null || node.getOperation() == null || node.getChildren() == null) {
        throw new InvalidSnapshotException("incomplete node " + node);
      }
      if (nodeMap.put(node.getId(), node) != null) {
        throw new InvalidSnapshotException("duplicate node " + node.getId());
      }
    }

    Set<OperationId> roots = new HashSet<>(rootIds);
    for (HistoryNode node : nodes) {
      if (node.getParent() == null) {
        if (!roots.contains(node.getId()) || node.getDepth() != 0) {
          throw new InvalidSnapshotException("root " + node.getId() + " not listed or not at depth 0");
        }
      } else {
        HistoryNode parent = nodeMap.get(node.getParent());
        if (parent == null || !parent.getChildren().contains(node.getId())) {
          throw new InvalidSnapshotException("node " + node.getId() + " not linked to parent " + node.getParent());
        }
        if (node.getDepth() != parent.getDepth() + 1) {
          throw new InvalidSnapshotException("node " + node.getId() + " has depth " + node.getDepth());
        }
      }
      for (OperationId childId : node.getChildren()) {
        HistoryNode child = nodeMap.get(childId);
        if (child == null || !node.getId().equals(child.getParent())) {
          throw new InvalidSnapshotException("child " + childId + " of " + node.getId() + " does not point back");
        }
      }
    }

    for (OperationId rootId : rootIds) {
      HistoryNode root = nodeMap.get(rootId);
      if (root == null || root.getParent() != null) {
        throw new InvalidSnapshotException("root " + rootId + " missing or has a parent");
      }
    }
    if (currentId != null && !nodeMap.containsKey(currentId)) {
      throw new InvalidSnapshotException("current node " + currentId + " missing");
    }
    for (Map.Entry<String, OperationId> branch : branches.entrySet()) {
      if (!nodeMap.containsKey(branch.getValue())) {
        throw new InvalidSnapshotException("branch '" + branch.getKey() + "' points at missing " + branch.getValue());
      }
    }
  }
}
