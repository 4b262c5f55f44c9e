package com.cad.example.historyTreeApp.history.serialization;

import com.cad.example.historyTreeApp.history.HistoryTree;
import com.cad.example.historyTreeApp.history.HistoryTreeConfig;
import com.cad.example.historyTreeApp.history.exception.HistorySerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON form of a history tree. Operation ids are written as integers and timestamps as ISO-8601
 * instants.
 */
@Slf4j
public class HistoryTreeJson {
  private final ObjectMapper objectMapper;

  public HistoryTreeJson() {
    this(createObjectMapper());
  }

  public HistoryTreeJson(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public static ObjectMapper createObjectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  public String write(final HistoryTree tree) {
    return writeSnapshot(tree.snapshot());
  }

  public String writeSnapshot(final HistoryTreeSnapshot snapshot) {
    try {
      return objectMapper.writeValueAsString(snapshot);
    } catch (JsonProcessingException ex) {
      log.error("History snapshot can not be written", ex);
      throw new HistorySerializationException("History snapshot can not be written", ex);
    }
  }

  public HistoryTreeSnapshot readSnapshot(final String json) {
    try {
      return objectMapper.readValue(json, HistoryTreeSnapshot.class);
    } catch (JsonProcessingException ex) {
      log.error("History snapshot can not be read", ex);
      throw new HistorySerializationException("History snapshot can not be read", ex);
    }
  }

  public HistoryTree read(final String json, final HistoryTreeConfig config) {
    return HistoryTree.restore(readSnapshot(json), config);
  }
}
