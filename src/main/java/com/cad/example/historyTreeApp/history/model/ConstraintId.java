package com.cad.example.historyTreeApp.history.model;

import lombok.Value;

@Value
public class ConstraintId {
  long id;
}
