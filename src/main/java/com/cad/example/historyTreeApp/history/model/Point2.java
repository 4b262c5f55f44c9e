package com.cad.example.historyTreeApp.history.model;

import lombok.Value;

@Value
public class Point2 {
  double x;
  double y;
}
