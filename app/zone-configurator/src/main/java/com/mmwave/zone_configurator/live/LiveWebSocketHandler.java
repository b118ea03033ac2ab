package com.mmwave.zone_configurator.live;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@RequiredArgsConstructor
public class LiveWebSocketHandler extends TextWebSocketHandler {

  private static final Logger logger = LoggerFactory.getLogger(LiveWebSocketHandler.class);
  static final String MDC_SESSION_ID = "live_session_id";

  private final LiveFanoutService liveFanoutService;

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    MDC.put(MDC_SESSION_ID, session.getId());
    try {
      liveFanoutService.open(session);
    } finally {
      MDC.remove(MDC_SESSION_ID);
    }
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    MDC.put(MDC_SESSION_ID, session.getId());
    try {
      liveFanoutService.handleMessage(session, message.getPayload());
    } finally {
      MDC.remove(MDC_SESSION_ID);
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    MDC.put(MDC_SESSION_ID, session.getId());
    try {
      logger.warn("live client transport error sessionId={}", session.getId(), exception);
      liveFanoutService.close(session);
    } finally {
      MDC.remove(MDC_SESSION_ID);
    }
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    MDC.put(MDC_SESSION_ID, session.getId());
    try {
      logger.debug("live client closed sessionId={} code={}", session.getId(), status.getCode());
      liveFanoutService.close(session);
    } finally {
      MDC.remove(MDC_SESSION_ID);
    }
  }
}
