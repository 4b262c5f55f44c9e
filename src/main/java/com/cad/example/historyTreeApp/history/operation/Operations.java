package com.cad.example.historyTreeApp.history.operation;

import com.cad.example.historyTreeApp.history.model.BooleanOp;
import com.cad.example.historyTreeApp.history.model.ConstraintId;
import com.cad.example.historyTreeApp.history.model.EntityId;
import com.cad.example.historyTreeApp.history.model.Point2;
import com.cad.example.historyTreeApp.history.model.VariableId;
import com.cad.example.historyTreeApp.history.model.Vector2;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Operation constructors backed by {@link OperationFactory#getDefault()}, i.e. the global id counter
 * and the UTC system clock.
 * <p>
 * Dependencies and affected entities are configured on the result:
 * <pre>
 *   Operations.moveEntities(ids, offset, positions, "Move")
 *     .withDependencies(List.of(createId))
 *     .withAffectedEntities(ids);
 * </pre>
 */
@UtilityClass
public class Operations {
  public Operation createEntity(final JsonNode entity, final String description) {
    return OperationFactory.getDefault().createEntity(entity, description);
  }

  public Operation deleteEntity(final EntityId entityId, final JsonNode previousEntity, final String description) {
    return OperationFactory.getDefault().deleteEntity(entityId, previousEntity, description);
  }

  public Operation modifyEntity(final EntityId entityId, final JsonNode previousGeometry, final JsonNode newGeometry,
                                final String description) {
    return OperationFactory.getDefault().modifyEntity(entityId, previousGeometry, newGeometry, description);
  }

  public Operation moveEntities(final List<EntityId> entityIds, final Vector2 offset,
                                final List<Point2> previousPositions, final String description) {
    return OperationFactory.getDefault().moveEntities(entityIds, offset, previousPositions, description);
  }

  public Operation rotateEntities(final List<EntityId> entityIds, final Point2 center, final double angle,
                                  final List<Double> previousAngles, final String description) {
    return OperationFactory.getDefault().rotateEntities(entityIds, center, angle, previousAngles, description);
  }

  public Operation scaleEntities(final List<EntityId> entityIds, final Point2 center, final double scale,
                                 final List<Double> previousScales, final String description) {
    return OperationFactory.getDefault().scaleEntities(entityIds, center, scale, previousScales, description);
  }

  public Operation booleanOperation(final BooleanOp op, final EntityId entity1, final EntityId entity2,
                                    final List<JsonNode> resultEntities, final List<JsonNode> previousEntities,
                                    final String description) {
    return OperationFactory.getDefault()
      .booleanOperation(op, entity1, entity2, resultEntities, previousEntities, description);
  }

  public Operation addConstraint(final JsonNode constraint, final String description) {
    return OperationFactory.getDefault().addConstraint(constraint, description);
  }

  public Operation removeConstraint(final ConstraintId constraintId, final JsonNode previousConstraint,
                                    final String description) {
    return OperationFactory.getDefault().removeConstraint(constraintId, previousConstraint, description);
  }

  public Operation modifyVariable(final VariableId variableId, final double previousValue, final double newValue,
                                  final String description) {
    return OperationFactory.getDefault().modifyVariable(variableId, previousValue, newValue, description);
  }

  public Operation groupOperation(final String name, final List<Operation> operations, final String description) {
    return OperationFactory.getDefault().groupOperation(name, operations, description);
  }

  public Operation custom(final String name, final byte[] payload, final String description) {
    return OperationFactory.getDefault().custom(name, payload, description);
  }
}
