package com.cad.example.historyTreeApp.history.model;

public enum BooleanOp {
  UNION,
  DIFFERENCE,
  INTERSECTION,
  XOR
}
