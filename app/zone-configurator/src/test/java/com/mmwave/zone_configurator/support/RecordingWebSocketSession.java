package com.mmwave.zone_configurator.support;

import java.net.InetSocketAddress;
import java.net.URI;
import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketExtension;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

public final class RecordingWebSocketSession implements WebSocketSession {

  private final String id;
  private final List<String> sent = new CopyOnWriteArrayList<>();
  private final List<Map<String, String>> mdcAtSend = new CopyOnWriteArrayList<>();
  private final Map<String, Object> attributes = new ConcurrentHashMap<>();
  private volatile boolean open = true;
  private volatile CloseStatus closeStatus;

  public RecordingWebSocketSession(String id) {
    this.id = id;
  }

  public List<String> sentPayloads() {
    return List.copyOf(sent);
  }

  public List<Map<String, String>> mdcAtSend() {
    return List.copyOf(mdcAtSend);
  }

  public CloseStatus closeStatus() {
    return closeStatus;
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public URI getUri() {
    return URI.create("ws://localhost/test");
  }

  @Override
  public HttpHeaders getHandshakeHeaders() {
    return new HttpHeaders();
  }

  @Override
  public Map<String, Object> getAttributes() {
    return attributes;
  }

  @Override
  public Principal getPrincipal() {
    return null;
  }

  @Override
  public InetSocketAddress getLocalAddress() {
    return null;
  }

  @Override
  public InetSocketAddress getRemoteAddress() {
    return null;
  }

  @Override
  public String getAcceptedProtocol() {
    return null;
  }

  @Override
  public void setTextMessageSizeLimit(int messageSizeLimit) {}

  @Override
  public int getTextMessageSizeLimit() {
    return Integer.MAX_VALUE;
  }

  @Override
  public void setBinaryMessageSizeLimit(int messageSizeLimit) {}

  @Override
  public int getBinaryMessageSizeLimit() {
    return Integer.MAX_VALUE;
  }

  @Override
  public List<WebSocketExtension> getExtensions() {
    return List.of();
  }

  @Override
  public void sendMessage(WebSocketMessage<?> message) {
    if (!open) {
      throw new IllegalStateException("session closed");
    }
    if (message instanceof TextMessage text) {
      sent.add(text.getPayload());
      final Map<String, String> context = MDC.getCopyOfContextMap();
      mdcAtSend.add(context == null ? Map.of() : Map.copyOf(context));
    }
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    close(CloseStatus.NORMAL);
  }

  @Override
  public void close(CloseStatus status) {
    open = false;
    closeStatus = status;
  }
}
