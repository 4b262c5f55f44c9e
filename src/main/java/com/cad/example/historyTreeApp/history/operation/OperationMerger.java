package com.cad.example.historyTreeApp.history.operation;

import com.cad.example.historyTreeApp.history.model.EntityId;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;

/**
 * Folds two consecutive operations into one.
 * <p>
 * Supported pairs:
 * - two moves of the same entity set: offsets are added
 * - two modifications of the same variable: first previous value, last new value
 * <p>
 * Any other pair, mixed kinds included, is not mergeable.
 */
@Slf4j
public class OperationMerger {
  private final OperationFactory operationFactory;
  private final Map<OperationTypeEnum, BiPredicate<Operation, Operation>> compatibilityMap =
    new EnumMap<>(OperationTypeEnum.class);
  private final Map<OperationTypeEnum, BinaryOperator<Operation>> mergeMap =
    new EnumMap<>(OperationTypeEnum.class);

  public OperationMerger(final OperationFactory operationFactory) {
    this.operationFactory = operationFactory;

    compatibilityMap.put(OperationTypeEnum.MOVE_ENTITIES, this::isSameEntitySet);
    compatibilityMap.put(OperationTypeEnum.MODIFY_VARIABLE, this::isSameVariable);

    mergeMap.put(OperationTypeEnum.MOVE_ENTITIES, this::mergeMoves);
    mergeMap.put(OperationTypeEnum.MODIFY_VARIABLE, this::mergeVariableModifications);
  }

  /**
   * @param earlier operation applied first (tree parent)
   * @param later   operation applied right after it (tree child)
   */
  public boolean canMerge(final Operation earlier, final Operation later) {
    if (earlier.getKind() != later.getKind()) {
      return false;
    }
    BiPredicate<Operation, Operation> predicate = compatibilityMap.get(earlier.getKind());
    return predicate != null && predicate.test(earlier, later);
  }

  /**
   * @return the merged operation with a fresh id, or empty if the pair is not mergeable
   */
  public Optional<Operation> merge(final Operation earlier, final Operation later) {
    if (!canMerge(earlier, later)) {
      return Optional.empty();
    }
    Operation merged = mergeMap.get(earlier.getKind()).apply(earlier, later);
    log.debug("Merged {} and {} into {}", earlier.getId(), later.getId(), merged.getId());
    return Optional.of(merged);
  }

  private boolean isSameEntitySet(final Operation earlier, final Operation later) {
    OperationType.MoveEntities first = (OperationType.MoveEntities) earlier.getType();
    OperationType.MoveEntities second = (OperationType.MoveEntities) later.getType();
    Set<EntityId> firstSet = new HashSet<>(first.getEntityIds());
    return firstSet.size() == new HashSet<>(second.getEntityIds()).size()
      && firstSet.containsAll(second.getEntityIds());
  }

  private boolean isSameVariable(final Operation earlier, final Operation later) {
    OperationType.ModifyVariable first = (OperationType.ModifyVariable) earlier.getType();
    OperationType.ModifyVariable second = (OperationType.ModifyVariable) later.getType();
    return first.getVariableId().equals(second.getVariableId());
  }

  private Operation mergeMoves(final Operation earlier, final Operation later) {
    OperationType.MoveEntities first = (OperationType.MoveEntities) earlier.getType();
    OperationType.MoveEntities second = (OperationType.MoveEntities) later.getType();

    // positions before the first move are the ones to restore on undo
    OperationType.MoveEntities type = new OperationType.MoveEntities(
      first.getEntityIds(),
      first.getOffset().plus(second.getOffset()),
      first.getPreviousPositions());
    return carryOver(operationFactory.create(type, later.getDescription()), earlier, later);
  }

  private Operation mergeVariableModifications(final Operation earlier, final Operation later) {
    OperationType.ModifyVariable first = (OperationType.ModifyVariable) earlier.getType();
    OperationType.ModifyVariable second = (OperationType.ModifyVariable) later.getType();

    OperationType.ModifyVariable type = new OperationType.ModifyVariable(
      first.getVariableId(), first.getPreviousValue(), second.getNewValue());
    String description = String.format("Merged variable modifications: %s -> %s",
      earlier.getDescription(), later.getDescription());
    return carryOver(operationFactory.create(type, description), earlier, later);
  }

  private Operation carryOver(final Operation merged, final Operation earlier, final Operation later) {
    Set<OperationId> dependencies = new LinkedHashSet<>(earlier.getDependencies());
    dependencies.addAll(later.getDependencies());
    dependencies.remove(earlier.getId());
    dependencies.remove(later.getId());

    Set<EntityId> affectedEntities = new LinkedHashSet<>(earlier.getAffectedEntities());
    affectedEntities.addAll(later.getAffectedEntities());

    return merged
      .withDependencies(new ArrayList<>(dependencies))
      .withAffectedEntities(new ArrayList<>(affectedEntities))
      .withUndoable(earlier.isUndoable() && later.isUndoable());
  }
}
