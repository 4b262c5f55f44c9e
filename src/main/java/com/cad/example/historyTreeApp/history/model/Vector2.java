package com.cad.example.historyTreeApp.history.model;

import lombok.Value;

@Value
public class Vector2 {
  public static final Vector2 ZERO = new Vector2(0.0, 0.0);

  double x;
  double y;

  public Vector2 plus(final Vector2 other) {
    return new Vector2(x + other.x, y + other.y);
  }
}
