package com.cad.example.historyTreeApp.history.operation;

import com.cad.example.historyTreeApp.history.model.BooleanOp;
import com.cad.example.historyTreeApp.history.model.ConstraintId;
import com.cad.example.historyTreeApp.history.model.EntityId;
import com.cad.example.historyTreeApp.history.model.Point2;
import com.cad.example.historyTreeApp.history.model.VariableId;
import com.cad.example.historyTreeApp.history.model.Vector2;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.util.List;

/**
 * What an operation changed. Every variant keeps the data needed to revert it.
 * <p>
 * Entity, geometry and constraint snapshots belong to the document layer and are carried as
 * opaque {@link JsonNode} trees; the history never reads them. Getters hand out copies of
 * snapshots and payloads.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = OperationType.CreateEntity.class, name = "CreateEntity"),
  @JsonSubTypes.Type(value = OperationType.DeleteEntity.class, name = "DeleteEntity"),
  @JsonSubTypes.Type(value = OperationType.ModifyEntity.class, name = "ModifyEntity"),
  @JsonSubTypes.Type(value = OperationType.MoveEntities.class, name = "MoveEntities"),
  @JsonSubTypes.Type(value = OperationType.RotateEntities.class, name = "RotateEntities"),
  @JsonSubTypes.Type(value = OperationType.ScaleEntities.class, name = "ScaleEntities"),
  @JsonSubTypes.Type(value = OperationType.BooleanOperation.class, name = "BooleanOperation"),
  @JsonSubTypes.Type(value = OperationType.AddConstraint.class, name = "AddConstraint"),
  @JsonSubTypes.Type(value = OperationType.RemoveConstraint.class, name = "RemoveConstraint"),
  @JsonSubTypes.Type(value = OperationType.ModifyVariable.class, name = "ModifyVariable"),
  @JsonSubTypes.Type(value = OperationType.GroupOperation.class, name = "GroupOperation"),
  @JsonSubTypes.Type(value = OperationType.Custom.class, name = "Custom")
})
public interface OperationType {
  OperationTypeEnum kind();

  @Value
  final class CreateEntity implements OperationType {
    JsonNode entity;

    public JsonNode getEntity() {
      return JsonNodes.copy(entity);
    }

    @Override
    public OperationTypeEnum kind() {
      return OperationTypeEnum.CREATE_ENTITY;
    }
  }

  @Value
  @JsonInclude(JsonInclude.Include.NON_NULL)
  final class DeleteEntity implements OperationType {
    EntityId entityId;
    JsonNode previousEntity;

    public JsonNode getPreviousEntity() {
      return JsonNodes.copy(previousEntity);
    }

    @Override
    public OperationTypeEnum kind() {
      return OperationTypeEnum.DELETE_ENTITY;
    }
  }

  @Value
  final class ModifyEntity implements OperationType {
    EntityId entityId;
    JsonNode previousGeometry;
    JsonNode newGeometry;

    public JsonNode getPreviousGeometry() {
      return JsonNodes.copy(previousGeometry);
    }

    public JsonNode getNewGeometry() {
      return JsonNodes.copy(newGeometry);
    }

    @Override
    public OperationTypeEnum kind() {
      return OperationTypeEnum.MODIFY_ENTITY;
    }
  }

  @Value
  final class MoveEntities implements OperationType {
    List<EntityId> entityIds;
    Vector2 offset;
    List<Point2> previousPositions;

    @Override
    public OperationTypeEnum kind() {
      return OperationTypeEnum.MOVE_ENTITIES;
    }
  }

  @Value
  final class RotateEntities implements OperationType {
    List<EntityId> entityIds;
    Point2 center;
    double angle;
    List<Double> previousAngles;

    @Override
    public OperationTypeEnum kind() {
      return OperationTypeEnum.ROTATE_ENTITIES;
    }
  }

  @Value
  final class ScaleEntities implements OperationType {
    List<EntityId> entityIds;
    Point2 center;
    double scale;
    List<Double> previousScales;

    @Override
    public OperationTypeEnum kind() {
      return OperationTypeEnum.SCALE_ENTITIES;
    }
  }

  @Value
  final class BooleanOperation implements OperationType {
    BooleanOp op;
    EntityId entity1;
    EntityId entity2;
    List<JsonNode> resultEntities;
    List<JsonNode> previousEntities;

    public List<JsonNode> getResultEntities() {
      return JsonNodes.copyAll(resultEntities);
    }

    public List<JsonNode> getPreviousEntities() {
      return JsonNodes.copyAll(previousEntities);
    }

    @Override
    public OperationTypeEnum kind() {
      return OperationTypeEnum.BOOLEAN_OPERATION;
    }
  }

  @Value
  final class AddConstraint implements OperationType {
    JsonNode constraint;

    public JsonNode getConstraint() {
      return JsonNodes.copy(constraint);
    }

    @Override
    public OperationTypeEnum kind() {
      return OperationTypeEnum.ADD_CONSTRAINT;
    }
  }

  @Value
  @JsonInclude(JsonInclude.Include.NON_NULL)
  final class RemoveConstraint implements OperationType {
    ConstraintId constraintId;
    JsonNode previousConstraint;

    public JsonNode getPreviousConstraint() {
      return JsonNodes.copy(previousConstraint);
    }

    @Override
    public OperationTypeEnum kind() {
      return OperationTypeEnum.REMOVE_CONSTRAINT;
    }
  }

  @Value
  final class ModifyVariable implements OperationType {
    VariableId variableId;
    double previousValue;
    double newValue;

    @Override
    public OperationTypeEnum kind() {
      return OperationTypeEnum.MODIFY_VARIABLE;
    }
  }

  /**
   * Several operations recorded as one undo step.
   */
  @Value
  final class GroupOperation implements OperationType {
    String name;
    List<Operation> operations;

    @Override
    public OperationTypeEnum kind() {
      return OperationTypeEnum.GROUP_OPERATION;
    }
  }

  @Value
  final class Custom implements OperationType {
    String name;
    byte[] payload;

    public byte[] getPayload() {
      return payload.clone();
    }

    @Override
    public OperationTypeEnum kind() {
      return OperationTypeEnum.CUSTOM;
    }
  }
}
