package com.mmwave.zone_configurator.live;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

final class LiveSession {

  private static final Logger logger = LoggerFactory.getLogger(LiveSession.class);

  private final WebSocketSession socket;
  private final ObjectMapper objectMapper;
  private volatile Interest interest;

  LiveSession(WebSocketSession socket, ObjectMapper objectMapper) {
    this.socket = socket;
    this.objectMapper = objectMapper;
  }

  String id() {
    return socket.getId();
  }

  void subscribe(String deviceId, String profileId, Set<String> entityIds) {
    this.interest = new Interest(deviceId, profileId, Set.copyOf(entityIds));
  }

  // 直前の関心を返す。未購読なら null
  Interest clearInterest() {
    final Interest previous = interest;
    this.interest = null;
    return previous;
  }

  String deviceId() {
    final Interest current = interest;
    return current == null ? null : current.deviceId();
  }

  boolean isInterestedIn(String entityId) {
    final Interest current = interest;
    return current != null && current.entityIds().contains(entityId);
  }

  boolean send(Object message) {
    if (!socket.isOpen()) {
      return false;
    }
    final String payload;
    try {
      payload = objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException ex) {
      logger.error("live message serialization failed sessionId={}", id(), ex);
      return false;
    }
    try {
      socket.sendMessage(new TextMessage(payload));
      return true;
    } catch (IOException | RuntimeException ex) {
      logger.warn("live message send failed sessionId={}", id(), ex);
      return false;
    }
  }

  void close(CloseStatus status) {
    if (!socket.isOpen()) {
      return;
    }
    try {
      socket.close(status);
    } catch (IOException ex) {
      logger.debug("live session close failed sessionId={}", id(), ex);
    }
  }

  record Interest(String deviceId, String profileId, Set<String> entityIds) {}
}
