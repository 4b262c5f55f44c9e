package com.cad.example.historyTreeApp.history.operation;

import com.cad.example.historyTreeApp.history.model.BooleanOp;
import com.cad.example.historyTreeApp.history.model.ConstraintId;
import com.cad.example.historyTreeApp.history.model.EntityId;
import com.cad.example.historyTreeApp.history.model.Point2;
import com.cad.example.historyTreeApp.history.model.VariableId;
import com.cad.example.historyTreeApp.history.model.Vector2;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Builds operations with ids from one generator and timestamps from one clock.
 * Payloads are only checked for presence; snapshots and byte payloads are copied.
 */
public class OperationFactory {
  private static final OperationFactory DEFAULT =
    new OperationFactory(OperationIdGenerator.global(), Clock.systemUTC());

  @Getter
  private final OperationIdGenerator idGenerator;
  private final Clock clock;

  public OperationFactory(final OperationIdGenerator idGenerator, final Clock clock) {
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public OperationFactory(final OperationIdGenerator idGenerator) {
    this(idGenerator, Clock.systemUTC());
  }

  public static OperationFactory getDefault() {
    return DEFAULT;
  }

  /**
   * Wrap a payload in a new undoable operation without dependencies or affected entities.
   */
  public Operation create(final OperationType type, final String description) {
    return new Operation(idGenerator.next(), type, clock.instant(), description, true, List.of(), List.of());
  }

  public Operation createEntity(final JsonNode entity, final String description) {
    return create(new OperationType.CreateEntity(
      JsonNodes.copy(Objects.requireNonNull(entity, "entity"))), description);
  }

  public Operation deleteEntity(final EntityId entityId, final JsonNode previousEntity, final String description) {
    return create(new OperationType.DeleteEntity(Objects.requireNonNull(entityId, "entityId"),
      JsonNodes.copy(previousEntity)),
      description);
  }

  public Operation modifyEntity(final EntityId entityId, final JsonNode previousGeometry, final JsonNode newGeometry,
                                final String description) {
    return create(new OperationType.ModifyEntity(
      Objects.requireNonNull(entityId, "entityId"),
      JsonNodes.copy(Objects.requireNonNull(previousGeometry, "previousGeometry")),
      JsonNodes.copy(Objects.requireNonNull(newGeometry, "newGeometry"))), description);
  }

  public Operation moveEntities(final List<EntityId> entityIds, final Vector2 offset,
                                final List<Point2> previousPositions, final String description) {
    return create(new OperationType.MoveEntities(
      List.copyOf(entityIds),
      Objects.requireNonNull(offset, "offset"),
      previousPositions == null ? List.of() : List.copyOf(previousPositions)), description);
  }

  public Operation rotateEntities(final List<EntityId> entityIds, final Point2 center, final double angle,
                                  final List<Double> previousAngles, final String description) {
    return create(new OperationType.RotateEntities(
      List.copyOf(entityIds),
      Objects.requireNonNull(center, "center"),
      angle,
      previousAngles == null ? List.of() : List.copyOf(previousAngles)), description);
  }

  public Operation scaleEntities(final List<EntityId> entityIds, final Point2 center, final double scale,
                                 final List<Double> previousScales, final String description) {
    return create(new OperationType.ScaleEntities(
      List.copyOf(entityIds),
      Objects.requireNonNull(center, "center"),
      scale,
      previousScales == null ? List.of() : List.copyOf(previousScales)), description);
  }

  public Operation booleanOperation(final BooleanOp op, final EntityId entity1, final EntityId entity2,
                                    final List<JsonNode> resultEntities, final List<JsonNode> previousEntities,
                                    final String description) {
    return create(new OperationType.BooleanOperation(
      Objects.requireNonNull(op, "op"),
      Objects.requireNonNull(entity1, "entity1"),
      Objects.requireNonNull(entity2, "entity2"),
      JsonNodes.copyAll(resultEntities),
      JsonNodes.copyAll(previousEntities)), description);
  }

  public Operation addConstraint(final JsonNode constraint, final String description) {
    return create(new OperationType.AddConstraint(
      JsonNodes.copy(Objects.requireNonNull(constraint, "constraint"))), description);
  }

  public Operation removeConstraint(final ConstraintId constraintId, final JsonNode previousConstraint,
                                    final String description) {
    return create(new OperationType.RemoveConstraint(
      Objects.requireNonNull(constraintId, "constraintId"), JsonNodes.copy(previousConstraint)), description);
  }

  public Operation modifyVariable(final VariableId variableId, final double previousValue, final double newValue,
                                  final String description) {
    return create(new OperationType.ModifyVariable(
      Objects.requireNonNull(variableId, "variableId"), previousValue, newValue), description);
  }

  public Operation groupOperation(final String name, final List<Operation> operations, final String description) {
    return create(new OperationType.GroupOperation(
      Objects.requireNonNull(name, "name"), List.copyOf(operations)), description);
  }

  public Operation custom(final String name, final byte[] payload, final String description) {
    return create(new OperationType.Custom(
      Objects.requireNonNull(name, "name"), Objects.requireNonNull(payload, "payload").clone()), description);
  }
}
