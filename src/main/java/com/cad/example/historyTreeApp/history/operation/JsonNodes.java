package com.cad.example.historyTreeApp.history.operation;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deep copies of document snapshots, so a stored operation cannot be changed through them.
 */
@UtilityClass
class JsonNodes {
  JsonNode copy(final JsonNode node) {
    return node == null ? null : node.deepCopy();
  }

  List<JsonNode> copyAll(final List<JsonNode> nodes) {
    List<JsonNode> copies = new ArrayList<>(nodes.size());
    for (JsonNode node : nodes) {
      copies.add(copy(node));
    }
    return Collections.unmodifiableList(copies);
  }
}
