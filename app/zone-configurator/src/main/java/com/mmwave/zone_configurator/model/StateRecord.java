package com.mmwave.zone_configurator.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public record StateRecord(
    String entityId,
    String state,
    Map<String, Object> attributes,
    Instant lastChanged,
    Instant lastUpdated) {

  private static final Logger logger = LoggerFactory.getLogger(StateRecord.class);

  public StateRecord {
    if (entityId == null || entityId.isBlank()) {
      throw new IllegalArgumentException("entityId is required");
    }
    attributes =
        attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public static StateRecord of(String entityId, String state, Instant lastChanged) {
    return new StateRecord(entityId, state, Map.of(), lastChanged, lastChanged);
  }

  public static StateRecord fromJson(JsonNode node) {
    if (node == null || node.isNull() || !node.isObject()) {
      return null;
    }
    final String entityId = node.path("entity_id").asText("");
    if (entityId.isBlank()) {
      return null;
    }
    final JsonNode stateNode = node.get("state");
    return new StateRecord(
        entityId,
        stateNode == null || stateNode.isNull() ? null : stateNode.asText(),
        toMap(node.get("attributes")),
        parseInstant(node.get("last_changed")),
        parseInstant(node.get("last_updated")));
  }

  private static Map<String, Object> toMap(JsonNode attributes) {
    if (attributes == null || !attributes.isObject()) {
      return Map.of();
    }
    final Map<String, Object> values = new LinkedHashMap<>();
    attributes.fields().forEachRemaining(entry -> values.put(entry.getKey(), toValue(entry.getValue())));
    return values;
  }

  private static Object toValue(JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isObject()) {
      return toMap(value);
    }
    if (value.isArray()) {
      final List<Object> items = new ArrayList<>();
      value.forEach(item -> items.add(toValue(item)));
      return items;
    }
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    if (value.isIntegralNumber()) {
      return value.longValue();
    }
    if (value.isNumber()) {
      return value.doubleValue();
    }
    return value.asText();
  }

  private static Instant parseInstant(JsonNode value) {
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value.asText()).toInstant();
    } catch (DateTimeParseException ex) {
      logger.debug("ignoring unparsable timestamp value={}", value.asText(), ex);
      return null;
    }
  }
}
