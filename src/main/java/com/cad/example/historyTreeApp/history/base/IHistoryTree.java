package com.cad.example.historyTreeApp.history.base;

import com.cad.example.historyTreeApp.history.HistoryNode;
import com.cad.example.historyTreeApp.history.HistoryStats;
import com.cad.example.historyTreeApp.history.operation.Operation;
import com.cad.example.historyTreeApp.history.operation.OperationId;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface IHistoryTree {
  void addOperation(final Operation operation);

  Optional<Operation> undo();

  Optional<Operation> redo();

  Operation gotoOperation(final OperationId operationId);

  void createBranch(final String branchName, final OperationId fromOperation);

  Operation switchBranch(final String branchName);

  Map<String, OperationId> getBranches();

  List<Operation> currentOperations();

  Optional<Operation> findOperation(final OperationId operationId);

  Optional<HistoryNode> getNode(final OperationId operationId);

  Map<OperationId, List<OperationId>> dependencyGraph();

  int compressHistory();

  HistoryStats getStats();

  String treeString();
}
