package com.mmwave.zone_configurator.transport.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HaMessageCodec {

  private static final Logger logger = LoggerFactory.getLogger(HaMessageCodec.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public HaMessageCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Optional<HaInboundMessage> decode(String payload) {
    final JsonNode node;
    try {
      node = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      logger.warn("dropping unparsable home assistant frame length={}", length(payload), ex);
      return Optional.empty();
    }
    if (node == null || !node.isObject()) {
      logger.warn("dropping non-object home assistant frame");
      return Optional.empty();
    }
    final String type = node.path("type").asText("");
    final HaInboundMessage message =
        switch (type) {
          case "auth_required" -> new HaInboundMessage.AuthRequired(text(node, "ha_version"));
          case "auth_ok" -> new HaInboundMessage.AuthOk(text(node, "ha_version"));
          case "auth_invalid" ->
              new HaInboundMessage.AuthInvalid(node.path("message").asText("Unknown auth error"));
          case "result" -> decodeResult(node);
          case "event" -> decodeEvent(node);
          default -> null;
        };
    if (message == null) {
      logger.debug("ignoring home assistant frame type={}", type);
    }
    return Optional.ofNullable(message);
  }

  public String encodeAuth(String accessToken) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put("type", "auth");
    node.put("access_token", accessToken);
    return write(node);
  }

  // id は常に先頭で、コマンド本体からは上書きできない
  public String encodeCommand(int id, Map<String, ?> command) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put("id", id);
    final ObjectNode body = objectMapper.valueToTree(command);
    body.remove("id");
    node.setAll(body);
    return write(node);
  }

  private HaInboundMessage decodeResult(JsonNode node) {
    if (!node.path("id").canConvertToInt()) {
      logger.warn("dropping result frame without id");
      return null;
    }
    return new HaInboundMessage.Result(
        node.path("id").asInt(),
        node.path("success").asBoolean(false),
        node.get("result"),
        node.get("error"));
  }

  private HaInboundMessage decodeEvent(JsonNode node) {
    final JsonNode event = node.path("event");
    if (!event.isObject()) {
      logger.warn("dropping event frame without event body");
      return null;
    }
    return new HaInboundMessage.Event(
        node.path("id").asInt(0), event.path("event_type").asText(""), event.path("data"));
  }

  private String write(ObjectNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("home assistant command is not serializable", ex);
    }
  }

  private static String text(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static int length(String payload) {
    return payload == null ? 0 : payload.length();
  }
}
