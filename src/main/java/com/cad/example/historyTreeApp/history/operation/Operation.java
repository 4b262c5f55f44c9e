package com.cad.example.historyTreeApp.history.operation;

import com.cad.example.historyTreeApp.history.model.EntityId;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One recorded edit. Operations are never changed after construction: the {@code with*} methods
 * return configured copies that keep the id, and merging produces a new operation with a new id.
 */
@Value
@With
public class Operation {
  OperationId id;
  OperationType type;
  Instant timestamp;
  String description;
  boolean undoable;
  // explicit dependencies, the tree parent is implicit
  List<OperationId> dependencies;
  List<EntityId> affectedEntities;

  @JsonCreator
  public Operation(@JsonProperty("id") final OperationId id,
                   @JsonProperty("type") final OperationType type,
                   @JsonProperty("timestamp") final Instant timestamp,
                   @JsonProperty("description") final String description,
                   @JsonProperty("undoable") final boolean undoable,
                   @JsonProperty("dependencies") final List<OperationId> dependencies,
                   @JsonProperty("affectedEntities") final List<EntityId> affectedEntities) {
    this.id = Objects.requireNonNull(id, "id");
    this.type = Objects.requireNonNull(type, "type");
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    this.description = Objects.requireNonNull(description, "description");
    this.undoable = undoable;
    this.dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    this.affectedEntities = affectedEntities == null ? List.of() : List.copyOf(affectedEntities);
  }

  @JsonIgnore
  public OperationTypeEnum getKind() {
    return type.kind();
  }
}
