package com.cad.example.historyTreeApp.history;

import com.cad.example.historyTreeApp.history.base.IHistoryTree;
import com.cad.example.historyTreeApp.history.exception.DuplicateBranchException;
import com.cad.example.historyTreeApp.history.exception.DuplicateOperationException;
import com.cad.example.historyTreeApp.history.exception.InvalidSnapshotException;
import com.cad.example.historyTreeApp.history.exception.OperationNotFoundException;
import com.cad.example.historyTreeApp.history.exception.UnknownBranchException;
import com.cad.example.historyTreeApp.history.operation.Operation;
import com.cad.example.historyTreeApp.history.operation.OperationId;
import com.cad.example.historyTreeApp.history.operation.OperationMerger;
import com.cad.example.historyTreeApp.history.operation.OperationType;
import com.cad.example.historyTreeApp.history.serialization.HistoryTreeSnapshot;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Branching history of the operations applied to one document.
 * <p>
 * Core components:
 * - node map (operation id to node), the only store of nodes; parent and children are kept as ids
 * - current node: where the document is now, null when nothing is applied
 * - undo stack: ids on the path from the root to the current node, root first
 * - redo stack: ids taken off the path by undo, the next one to redo on top
 * - branch map: names of nodes to come back to
 * <p>
 * Adding an operation links it under the current node. After an undo the next added operation
 * becomes a second child of the current node, which is how branches appear. Nodes are only removed
 * by compression.
 * <p>
 * The undo and redo stacks mirror the tree: add, undo and redo update them in place, jumps
 * ({@link #gotoOperation}, {@link #switchBranch}) rebuild them from parent links.
 * <p>
 * Adding an operation after everything was undone starts another top level timeline, so the tree
 * can have several roots; {@link #getRootId()} is the first of them.
 * <p>
 * Not thread safe. One editing session owns the tree and calls it sequentially; concurrent readers
 * have to be excluded from writes by the owner.
 * <p>
 * Exception handling policy: every argument check happens before the tree is changed, a call that
 * throws leaves the tree as it was.
 */
@Slf4j
public class HistoryTree implements IHistoryTree {
  @Getter
  private final HistoryTreeConfig config;
  private final OperationMerger operationMerger;

  private final Map<OperationId, HistoryNode> nodeMap = new LinkedHashMap<>();
  private final List<OperationId> rootIds = new ArrayList<>();
  private final List<OperationId> undoStack = new ArrayList<>();
  private final List<OperationId> redoStack = new ArrayList<>();
  private final Map<String, OperationId> branchMap = new LinkedHashMap<>();
  private OperationId currentId;

  private int totalOperations;
  private int compressionSavings;
  private Instant lastOperationTime;

  public HistoryTree() {
    this(HistoryTreeConfig.defaults());
  }

  public HistoryTree(final int maxOperations) {
    this(HistoryTreeConfig.withMaxOperations(maxOperations));
  }

  public HistoryTree(final HistoryTreeConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    if (config.getMaxOperations() < 1) {
      throw new IllegalArgumentException("maxOperations should be positive: " + config.getMaxOperations());
    }
    this.operationMerger = new OperationMerger(config.getOperationFactory());
  }

  /**
   * Record an applied operation as the child of the current node and make it current.
   * Compresses the history first when the node count has reached the configured maximum.
   * Clears the redo stack.
   *
   * @param operation operation to add, its id should not be in the tree yet
   */
  @Override
  public void addOperation(final Operation operation) {
    Objects.requireNonNull(operation, "operation");
    OperationId operationId = operation.getId();
    if (operationId.isNull() || nodeMap.containsKey(operationId)) {
      log.warn("Operation rejected, id already used: {}", operationId);
      throw new DuplicateOperationException(operationId);
    }
    // merged operations take ids from the configured generator, which may not have issued this one
    config.getOperationFactory().getIdGenerator().advancePast(operationId);

    if (config.isAutoCompress() && nodeMap.size() >= config.getMaxOperations()) {
      log.debug("Node count {} reached maximum {}, compressing", nodeMap.size(), config.getMaxOperations());
      compressHistory();
    }

    OperationId parentId = currentId;
    int depth = parentId == null ? 0 : nodeMap.get(parentId).getDepth() + 1;
    nodeMap.put(operationId, new HistoryNode(operation, parentId, depth));
    if (parentId == null) {
      rootIds.add(operationId);
    } else {
      nodeMap.get(parentId).addChild(operationId);
    }

    setCurrentNode(operationId);
    undoStack.add(operationId);
    redoStack.clear();

    ++totalOperations;
    lastOperationTime = operation.getTimestamp();
    log.debug("Operation added {} '{}', parent {}, depth {}",
      operationId, operation.getDescription(), parentId, depth);
    assert isConsistent() : "tree inconsistent after addOperation " + operationId;
  }

  /**
   * Step back to the parent of the current node.
   *
   * @return the undone operation for the caller to revert, empty if there is nothing to undo
   */
  @Override
  public Optional<Operation> undo() {
    if (currentId == null || undoStack.isEmpty()) {
      return Optional.empty();
    }

    OperationId undoneId = undoStack.remove(undoStack.size() - 1);
    redoStack.add(undoneId);
    HistoryNode undone = nodeMap.get(undoneId);
    setCurrentNode(undone.getParent());

    log.debug("Undo {}, current {}", undoneId, currentId);
    return Optional.of(undone.getOperation());
  }

  /**
   * Re-apply the most recently undone operation.
   *
   * @return the redone operation for the caller to apply again, empty if there is nothing to redo
   */
  @Override
  public Optional<Operation> redo() {
    if (redoStack.isEmpty()) {
      return Optional.empty();
    }

    OperationId redoneId = redoStack.remove(redoStack.size() - 1);
    undoStack.add(redoneId);
    setCurrentNode(redoneId);

    log.debug("Redo {}", redoneId);
    return Optional.of(nodeMap.get(redoneId).getOperation());
  }

  public boolean canUndo() {
    return currentId != null && !undoStack.isEmpty();
  }

  public boolean canRedo() {
    return !redoStack.isEmpty();
  }

  /**
   * Jump to any node. The undo stack is rebuilt as the path from the root to that node,
   * the redo stack is dropped.
   *
   * @param operationId node to jump to
   * @return the operation of that node
   */
  @Override
  public Operation gotoOperation(final OperationId operationId) {
    Objects.requireNonNull(operationId, "operationId");
    if (!nodeMap.containsKey(operationId)) {
      log.warn("Goto rejected, operation not found: {}", operationId);
      throw new OperationNotFoundException(operationId);
    }

    rebuildStacks(operationId);
    setCurrentNode(operationId);
    HistoryNode target = nodeMap.get(operationId);
    log.debug("Moved to {}, depth {}", operationId, target.getDepth());
    return target.getOperation();
  }

  /**
   * Register a name for an existing node. Branches only name nodes, they do not restrict
   * where new operations are added.
   */
  @Override
  public void createBranch(final String branchName, final OperationId fromOperation) {
    Objects.requireNonNull(branchName, "branchName");
    Objects.requireNonNull(fromOperation, "fromOperation");
    if (!nodeMap.containsKey(fromOperation)) {
      log.warn("Branch '{}' rejected, operation not found: {}", branchName, fromOperation);
      throw new OperationNotFoundException(fromOperation);
    }
    if (branchMap.containsKey(branchName)) {
      log.warn("Branch '{}' rejected, name already used", branchName);
      throw new DuplicateBranchException(branchName, branchMap.get(branchName));
    }

    branchMap.put(branchName, fromOperation);
    log.debug("Branch '{}' created at {}", branchName, fromOperation);
  }

  @Override
  public Operation switchBranch(final String branchName) {
    Objects.requireNonNull(branchName, "branchName");
    OperationId target = branchMap.get(branchName);
    if (target == null) {
      log.warn("Switch rejected, branch not found: '{}'", branchName);
      throw new UnknownBranchException(branchName);
    }
    return gotoOperation(target);
  }

  @Override
  public Map<String, OperationId> getBranches() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(branchMap));
  }

  /**
   * @return operations from the root to the current node, oldest first
   */
  @Override
  public List<Operation> currentOperations() {
    List<Operation> result = new ArrayList<>();
    for (OperationId id : pathFromRoot(currentId)) {
      result.add(nodeMap.get(id).getOperation());
    }
    return result;
  }

  @Override
  public Optional<Operation> findOperation(final OperationId operationId) {
    return Optional.ofNullable(nodeMap.get(operationId)).map(HistoryNode::getOperation);
  }

  /**
   * @return a copy of the node, changes to it do not affect the tree
   */
  @Override
  public Optional<HistoryNode> getNode(final OperationId operationId) {
    return Optional.ofNullable(nodeMap.get(operationId)).map(HistoryNode::copy);
  }

  public Optional<OperationId> getCurrentId() {
    return Optional.ofNullable(currentId);
  }

  public Optional<OperationId> getRootId() {
    return rootIds.isEmpty() ? Optional.empty() : Optional.of(rootIds.get(0));
  }

  public List<OperationId> getRootIds() {
    return List.copyOf(rootIds);
  }

  public int size() {
    return nodeMap.size();
  }

  public boolean isEmpty() {
    return nodeMap.isEmpty();
  }

  /**
   * For every node: its explicit dependencies followed by its tree parent.
   * Computed on each call.
   */
  @Override
  public Map<OperationId, List<OperationId>> dependencyGraph() {
    Map<OperationId, List<OperationId>> graph = new LinkedHashMap<>();
    for (HistoryNode node : nodeMap.values()) {
      Set<OperationId> dependencies = new LinkedHashSet<>(node.getOperation().getDependencies());
      if (node.getParent() != null) {
        dependencies.add(node.getParent());
      }
      graph.put(node.getId(), new ArrayList<>(dependencies));
    }
    return graph;
  }

  /**
   * Fold mergeable parent/child pairs into single nodes.
   * <p>
   * A child is folded into its parent when the merger accepts the pair, the parent has no other
   * child, and neither of them is the current node or a branch target. The merged operation gets
   * a new id and takes the parent's place; the child's children move up one level.
   *
   * @return number of removed nodes
   */
  @Override
  public int compressHistory() {
    int removed = 0;
    Deque<OperationId> pending = new ArrayDeque<>(rootIds);
    OperationId nodeId;
    while ((nodeId = pending.poll()) != null) {
      HistoryNode node = nodeMap.get(nodeId);
      while (isFoldable(node)) {
        node = foldOnlyChild(node);
        ++removed;
      }
      pending.addAll(node.getChildren());
    }

    if (removed > 0) {
      compressionSavings += removed;
      log.info("History compressed: {} nodes removed, {} left", removed, nodeMap.size());
    } else {
      log.debug("Compression removed nothing, {} nodes walked", nodeMap.size());
    }
    assert isConsistent() : "tree inconsistent after compressHistory";
    return removed;
  }

  @Override
  public HistoryStats getStats() {
    return HistoryStats.builder()
      .totalOperations(totalOperations)
      .nodeCount(nodeMap.size())
      .currentDepth(currentId == null ? 0 : nodeMap.get(currentId).getDepth())
      .branchCount(branchMap.size())
      .compressionSavings(compressionSavings)
      .lastOperationTime(lastOperationTime)
      .build();
  }

  /**
   * One line per node, indented by depth. The current node is marked with {@code >},
   * the rest of the path from the root to it with {@code *}.
   * <pre>
   * * 1: Create line
   *   * 2: Move line
   *       3: Delete line
   *     > 4: Rotate line
   * </pre>
   */
  @Override
  public String treeString() {
    Set<OperationId> activePath = new LinkedHashSet<>(undoStack);
    StringBuilder result = new StringBuilder();
    Deque<OperationId> pending = new ArrayDeque<>();
    for (int index = rootIds.size() - 1; index >= 0; --index) {
      pending.push(rootIds.get(index));
    }

    OperationId nodeId;
    while ((nodeId = pending.poll()) != null) {
      HistoryNode node = nodeMap.get(nodeId);
      String marker = "  ";
      if (nodeId.equals(currentId)) {
        marker = "> ";
      } else if (activePath.contains(nodeId)) {
        marker = "* ";
      }
      result.append("  ".repeat(node.getDepth()))
        .append(marker)
        .append(nodeId.getValue())
        .append(": ")
        .append(node.getOperation().getDescription())
        .append('\n');

      List<OperationId> children = node.getChildren();
      for (int index = children.size() - 1; index >= 0; --index) {
        pending.push(children.get(index));
      }
    }
    return result.toString();
  }

  /**
   * Export the node map, roots, current node, branches and statistics.
   * The snapshot holds copies of the nodes.
   */
  public HistoryTreeSnapshot snapshot() {
    List<HistoryNode> nodes = new ArrayList<>(nodeMap.size());
    for (HistoryNode node : nodeMap.values()) {
      nodes.add(node.copy());
    }
    return new HistoryTreeSnapshot(nodes, List.copyOf(rootIds), currentId, new LinkedHashMap<>(branchMap),
      getStats());
  }

  /**
   * Rebuild a tree from a snapshot. The undo stack is rebuilt as the path to the saved current node,
   * the redo stack starts empty. The id generator of {@code config} is moved past every restored id.
   *
   * @throws InvalidSnapshotException if the snapshot is not a well formed tree
   */
  public static HistoryTree restore(final HistoryTreeSnapshot snapshot, final HistoryTreeConfig config) {
    snapshot.validate();

    HistoryTree tree = new HistoryTree(config);
    for (HistoryNode node : snapshot.getNodes()) {
      HistoryNode restored = node.copy();
      restored.setActive(false);
      tree.nodeMap.put(restored.getId(), restored);
      advanceGeneratorPast(config, restored.getOperation());
    }
    tree.rootIds.addAll(snapshot.getRootIds());
    tree.branchMap.putAll(snapshot.getBranches());

    HistoryStats stats = snapshot.getStats() == null ? HistoryStats.EMPTY : snapshot.getStats();
    tree.totalOperations = stats.getTotalOperations();
    tree.compressionSavings = stats.getCompressionSavings();
    tree.lastOperationTime = stats.getLastOperationTime();

    if (snapshot.getCurrentId() != null) {
      tree.rebuildStacks(snapshot.getCurrentId());
      tree.setCurrentNode(snapshot.getCurrentId());
    }
    log.debug("History restored: {} nodes, current {}", tree.nodeMap.size(), tree.currentId);
    assert tree.isConsistent() : "tree inconsistent after restore";
    return tree;
  }

  private static void advanceGeneratorPast(final HistoryTreeConfig config, final Operation operation) {
    config.getOperationFactory().getIdGenerator().advancePast(operation.getId());
    if (operation.getType() instanceof OperationType.GroupOperation) {
      for (Operation nested : ((OperationType.GroupOperation) operation.getType()).getOperations()) {
        advanceGeneratorPast(config, nested);
      }
    }
  }

  private boolean isFoldable(final HistoryNode parent) {
    if (parent.getChildren().size() != 1) {
      return false;
    }
    HistoryNode child = nodeMap.get(parent.getChildren().get(0));
    if (isPinned(parent.getId()) || isPinned(child.getId())) {
      return false;
    }
    return operationMerger.canMerge(parent.getOperation(), child.getOperation());
  }

  private boolean isPinned(final OperationId nodeId) {
    return nodeId.equals(currentId) || branchMap.containsValue(nodeId);
  }

  private HistoryNode foldOnlyChild(final HistoryNode parent) {
    OperationId parentId = parent.getId();
    HistoryNode child = nodeMap.get(parent.getChildren().get(0));
    OperationId childId = child.getId();
    Operation merged = operationMerger.merge(parent.getOperation(), child.getOperation())
      .orElseThrow(() -> new IllegalStateException("Merge refused after compatibility check: "
        + parentId + ", " + childId));
    OperationId mergedId = merged.getId();
    if (nodeMap.containsKey(mergedId)) {
      log.warn("Fold of {} into {} rejected, merged id {} already used", childId, parentId, mergedId);
      throw new DuplicateOperationException(mergedId);
    }

    HistoryNode folded = parent.withOperation(merged);
    folded.setChildren(new ArrayList<>(child.getChildren()));
    nodeMap.remove(parentId);
    nodeMap.remove(childId);
    nodeMap.put(mergedId, folded);

    if (folded.isRoot()) {
      rootIds.set(rootIds.indexOf(parentId), mergedId);
    } else {
      nodeMap.get(folded.getParent()).replaceChild(parentId, mergedId);
    }
    for (OperationId grandChildId : folded.getChildren()) {
      nodeMap.get(grandChildId).setParent(mergedId);
      shiftSubtreeDepth(grandChildId, -1);
    }

    replaceMergedPair(undoStack, parentId, childId, mergedId);
    replaceMergedPair(redoStack, parentId, childId, mergedId);

    log.debug("Folded {} into {} as {}", childId, parentId, mergedId);
    return folded;
  }

  private void replaceMergedPair(final List<OperationId> stack, final OperationId parentId,
                                 final OperationId childId, final OperationId mergedId) {
    int index = stack.indexOf(parentId);
    if (index != -1) {
      stack.set(index, mergedId);
    }
    stack.remove(childId);
  }

  private void shiftSubtreeDepth(final OperationId subtreeRoot, final int delta) {
    Deque<OperationId> pending = new ArrayDeque<>();
    pending.push(subtreeRoot);
    OperationId nodeId;
    while ((nodeId = pending.poll()) != null) {
      HistoryNode node = nodeMap.get(nodeId);
      node.setDepth(node.getDepth() + delta);
      pending.addAll(node.getChildren());
    }
  }

  private void setCurrentNode(final OperationId nodeId) {
    if (currentId != null) {
      HistoryNode previous = nodeMap.get(currentId);
      if (previous != null) {
        previous.setActive(false);
      }
    }

    currentId = nodeId;
    if (nodeId != null) {
      nodeMap.get(nodeId).setActive(true);
    }
  }

  private void rebuildStacks(final OperationId target) {
    undoStack.clear();
    redoStack.clear();
    undoStack.addAll(pathFromRoot(target));
  }

  /**
   * @return ids from the root (inclusively) to {@code nodeId} (inclusively), empty for null
   */
  private List<OperationId> pathFromRoot(final OperationId nodeId) {
    List<OperationId> path = new ArrayList<>();
    OperationId id = nodeId;
    while (id != null) {
      path.add(id);
      id = nodeMap.get(id).getParent();
    }
    Collections.reverse(path);
    return path;
  }

  /**
   * Structural check used by assertions: links are mutual, depths match, only the current node is
   * active, the undo stack is the path to the current node, branches point at existing nodes.
   */
  boolean isConsistent() {
    for (Map.Entry<OperationId, HistoryNode> entry : nodeMap.entrySet()) {
      HistoryNode node = entry.getValue();
      if (!entry.getKey().equals(node.getId())) {
        log.error("Node stored under {} has id {}", entry.getKey(), node.getId());
        return false;
      }
      if (node.isRoot()) {
        if (!rootIds.contains(node.getId()) || node.getDepth() != 0) {
          log.error("Root node {} not registered or has depth {}", node.getId(), node.getDepth());
          return false;
        }
      } else {
        HistoryNode parent = nodeMap.get(node.getParent());
        if (parent == null || !parent.getChildren().contains(node.getId())
          || node.getDepth() != parent.getDepth() + 1) {
          log.error("Node {} is not linked to parent {}", node.getId(), node.getParent());
          return false;
        }
      }
      for (OperationId childId : node.getChildren()) {
        HistoryNode child = nodeMap.get(childId);
        if (child == null || !node.getId().equals(child.getParent())) {
          log.error("Child {} of {} does not point back", childId, node.getId());
          return false;
        }
      }
      if (node.isActive() != node.getId().equals(currentId)) {
        log.error("Node {} active flag {} does not match current {}", node.getId(), node.isActive(), currentId);
        return false;
      }
    }
    for (OperationId rootId : rootIds) {
      if (!nodeMap.containsKey(rootId)) {
        log.error("Root {} not found", rootId);
        return false;
      }
    }
    if (currentId != null && !nodeMap.containsKey(currentId)) {
      log.error("Current node {} not found", currentId);
      return false;
    }
    if (!undoStack.equals(pathFromRoot(currentId))) {
      log.error("Undo stack {} is not the path to {}", undoStack, currentId);
      return false;
    }
    for (OperationId redoId : redoStack) {
      if (!nodeMap.containsKey(redoId)) {
        log.error("Redo entry {} not found", redoId);
        return false;
      }
    }
    for (Map.Entry<String, OperationId> branch : branchMap.entrySet()) {
      if (!nodeMap.containsKey(branch.getValue())) {
        log.error("Branch '{}' points at missing node {}", branch.getKey(), branch.getValue());
        return false;
      }
    }
    return true;
  }
}
