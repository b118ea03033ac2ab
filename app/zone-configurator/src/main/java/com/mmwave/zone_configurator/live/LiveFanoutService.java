/*
 * どこで: Zone Configurator live 配信
 * 何を: 単一の上流 state 購読を、各 live クライアントの関心エンティティへ振り分けて送信する
 * なぜ: クライアント数に関わらず HA への購読を 1 本に保つため
 */
package com.mmwave.zone_configurator.live;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mmwave.common.Ids;
import com.mmwave.zone_configurator.config.LiveProperties;
import com.mmwave.zone_configurator.live.message.ErrorMessage;
import com.mmwave.zone_configurator.live.message.LiveClientMessage;
import com.mmwave.zone_configurator.live.message.LiveEntityState;
import com.mmwave.zone_configurator.live.message.StateUpdateMessage;
import com.mmwave.zone_configurator.live.message.SubscribedMessage;
import com.mmwave.zone_configurator.live.message.WarningMessage;
import com.mmwave.zone_configurator.mapping.EntityMappingResolver;
import com.mmwave.zone_configurator.mapping.EntityResolution;
import com.mmwave.zone_configurator.mapping.EntityResolutionException;
import com.mmwave.zone_configurator.mapping.EntityResolutionRequest;
import com.mmwave.zone_configurator.model.StateRecord;
import com.mmwave.zone_configurator.service.ZoneConfiguratorMetrics;
import com.mmwave.zone_configurator.transport.StateTransport;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

@Service
public class LiveFanoutService {

  private static final Logger logger = LoggerFactory.getLogger(LiveFanoutService.class);

  static final String INVALID_MESSAGE = "Invalid message format";
  static final String IDS_REQUIRED = "deviceId and profileId required";
  static final String MDC_DEVICE_ID = "device_id";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StateTransport は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StateTransport stateTransport;

  private final EntityMappingResolver entityMappingResolver;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final LiveProperties properties;
  private final ZoneConfiguratorMetrics metrics;
  private final Clock clock;
  private final ConcurrentMap<String, LiveSession> sessions = new ConcurrentHashMap<>();
  private final Object upstreamLock = new Object();
  private String upstreamSubscriptionId;

  public LiveFanoutService(
      StateTransport stateTransport,
      EntityMappingResolver entityMappingResolver,
      ObjectMapper objectMapper,
      LiveProperties properties,
      ZoneConfiguratorMetrics metrics,
      Clock clock) {
    this.stateTransport = stateTransport;
    this.entityMappingResolver = entityMappingResolver;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    metrics.bindLiveSessions(sessions);
  }

  @PostConstruct
  public void start() {
    synchronized (upstreamLock) {
      if (upstreamSubscriptionId != null) {
        return;
      }
      upstreamSubscriptionId = stateTransport.subscribeToStateChanges(List.of(), this::onStateChange);
    }
    logger.info(
        "live fan-out started transport={} subscriptionId={}",
        stateTransport.kind().value(),
        upstreamSubscriptionId);
  }

  @PreDestroy
  public void stop() {
    final String subscriptionId;
    synchronized (upstreamLock) {
      subscriptionId = upstreamSubscriptionId;
      upstreamSubscriptionId = null;
    }
    if (subscriptionId != null) {
      stateTransport.unsubscribe(subscriptionId);
    }
    sessions.values().forEach(session -> session.close(CloseStatus.GOING_AWAY));
    sessions.clear();
    logger.info("live fan-out stopped");
  }

  public void open(WebSocketSession socket) {
    final WebSocketSession decorated =
        new ConcurrentWebSocketSessionDecorator(
            socket,
            (int) properties.sendTimeLimit().toMillis(),
            properties.sendBufferLimitBytes());
    sessions.put(socket.getId(), new LiveSession(decorated, objectMapper));
    logger.info("live client connected sessionId={} sessions={}", socket.getId(), sessions.size());
  }

  public void close(WebSocketSession socket) {
    if (sessions.remove(socket.getId()) != null) {
      logger.info(
          "live client disconnected sessionId={} sessions={}", socket.getId(), sessions.size());
    }
  }

  public void handleMessage(WebSocketSession socket, String payload) {
    final LiveSession session = sessions.get(socket.getId());
    if (session == null) {
      logger.warn("message from unknown live session sessionId={}", socket.getId());
      return;
    }
    final LiveClientMessage message;
    try {
      message = objectMapper.readValue(payload, LiveClientMessage.class);
    } catch (JsonProcessingException ex) {
      logger.warn("invalid live message sessionId={}", session.id(), ex);
      send(session, ErrorMessage.of(INVALID_MESSAGE), "error");
      return;
    }
    final String type = message.type() == null ? "" : message.type();
    switch (type) {
      case "subscribe" -> subscribe(session, message);
      case "unsubscribe" -> {
        final LiveSession.Interest previous = session.clearInterest();
        if (previous == null) {
          logger.debug("live client unsubscribed without interest sessionId={}", session.id());
        } else {
          logger.info(
              "live client unsubscribed sessionId={} deviceId={} profileId={}",
              session.id(),
              previous.deviceId(),
              previous.profileId());
        }
      }
      default -> logger.debug("ignoring live message sessionId={} type={}", session.id(), type);
    }
  }

  public int activeSessionCount() {
    return sessions.size();
  }

  void onStateChange(String entityId, StateRecord newState, StateRecord previousState) {
    if (newState == null) {
      return;
    }
    StateUpdateMessage update = null;
    for (LiveSession session : sessions.values()) {
      if (!session.isInterestedIn(entityId)) {
        continue;
      }
      if (update == null) {
        update =
            StateUpdateMessage.of(
                entityId, newState.state(), newState.attributes(), clock.millis());
      }
      MDC.put(LiveWebSocketHandler.MDC_SESSION_ID, session.id());
      final String deviceId = session.deviceId();
      if (deviceId != null) {
        MDC.put(MDC_DEVICE_ID, deviceId);
      }
      try {
        send(session, update, "state_update");
      } finally {
        MDC.remove(LiveWebSocketHandler.MDC_SESSION_ID);
        MDC.remove(MDC_DEVICE_ID);
      }
    }
  }

  private void subscribe(LiveSession session, LiveClientMessage message) {
    if (Ids.isBlank(message.deviceId()) || Ids.isBlank(message.profileId())) {
      send(session, ErrorMessage.of(IDS_REQUIRED), "error");
      return;
    }
    final EntityResolution resolution;
    try {
      resolution =
          entityMappingResolver.resolveEntitiesForDevice(
              new EntityResolutionRequest(
                  message.deviceId(),
                  message.profileId(),
                  message.entityNamePrefix(),
                  parseMappings(message.entityMappings())));
    } catch (EntityResolutionException ex) {
      logger.warn(
          "live subscribe rejected sessionId={} deviceId={} reason={}",
          session.id(),
          message.deviceId(),
          ex.getMessage());
      send(session, ErrorMessage.of(ex.getMessage()), "error");
      return;
    }
    if (!resolution.hasMappings()) {
      logger.warn(
          "no entity mappings for device, using naming convention deviceId={}",
          message.deviceId());
      send(session, WarningMessage.mappingNotFound(message.deviceId()), "warning");
    }
    session.subscribe(message.deviceId(), message.profileId(), resolution.entityIds());
    final List<String> entities = List.copyOf(resolution.entityIds());
    logger.info(
        "live client subscribed sessionId={} deviceId={} profileId={} entityCount={}",
        session.id(),
        message.deviceId(),
        message.profileId(),
        entities.size());
    send(
        session,
        SubscribedMessage.of(
            message.deviceId(),
            message.profileId(),
            entities,
            fetchInitialStates(entities),
            resolution.hasMappings()),
        "subscribed");
  }

  private Map<String, LiveEntityState> fetchInitialStates(List<String> entities) {
    try {
      final Map<String, LiveEntityState> initial = new LinkedHashMap<>();
      stateTransport
          .getStates(entities)
          .forEach(
              (entityId, record) ->
                  initial.put(entityId, new LiveEntityState(record.state(), record.attributes())));
      return initial;
    } catch (RuntimeException ex) {
      logger.error("initial state fetch failed entityCount={}", entities.size(), ex);
      return null;
    }
  }

  private JsonNode parseMappings(JsonNode mappings) {
    if (mappings == null || mappings.isNull()) {
      return null;
    }
    if (!mappings.isTextual()) {
      return mappings;
    }
    try {
      return objectMapper.readTree(mappings.asText());
    } catch (JsonProcessingException ex) {
      logger.warn("ignoring unparsable entityMappings", ex);
      return null;
    }
  }

  private void send(LiveSession session, Object message, String type) {
    if (session.send(message)) {
      metrics.recordLiveMessage(type);
    }
  }
}
