package com.cad.example.historyTreeApp.history.operation;

public enum OperationTypeEnum {
  CREATE_ENTITY,
  DELETE_ENTITY,
  MODIFY_ENTITY,
  MOVE_ENTITIES,
  ROTATE_ENTITIES,
  SCALE_ENTITIES,
  BOOLEAN_OPERATION,
  ADD_CONSTRAINT,
  REMOVE_CONSTRAINT,
  MODIFY_VARIABLE,
  GROUP_OPERATION,
  CUSTOM
}
