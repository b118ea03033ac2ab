/*
 * どこで: Zone Configurator 読み取りトランスポート (WebSocket)
 * 何を: HA WebSocket API の認証、要求 ID 相関、state_changed 購読の共有と再接続を扱う
 * なぜ: HA への購読を 1 本に保ち、再接続後も利用側へ透過的に通知を続けるため
 */
package com.mmwave.zone_configurator.transport;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.mmwave.zone_configurator.config.HomeAssistantConnection;
import com.mmwave.zone_configurator.config.TransportProperties;
import com.mmwave.zone_configurator.model.AreaRegistryEntry;
import com.mmwave.zone_configurator.model.ConnectionState;
import com.mmwave.zone_configurator.model.DeviceRegistryEntry;
import com.mmwave.zone_configurator.model.EntityRegistryEntry;
import com.mmwave.zone_configurator.model.StateRecord;
import com.mmwave.zone_configurator.model.TransportKind;
import com.mmwave.zone_configurator.service.ZoneConfiguratorMetrics;
import com.mmwave.zone_configurator.transport.TransportTimers.TimerHandle;
import com.mmwave.zone_configurator.transport.message.HaInboundMessage;
import com.mmwave.zone_configurator.transport.message.HaMessageCodec;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

public class WebSocketStateTransport implements StateTransport {

  private static final Logger logger = LoggerFactory.getLogger(WebSocketStateTransport.class);

  private static final int SEND_TIME_LIMIT_MILLIS = 10_000;
  private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

  private final HomeAssistantConnection connection;
  private final TransportProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "WebSocketClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final WebSocketClient webSocketClient;

  private final HaMessageCodec codec;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final TransportTimers timers;
  private final SubscriptionRegistry subscriptions;
  private final ZoneConfiguratorMetrics metrics;

  private final Object lock = new Object();
  private final Map<Integer, CompletableFuture<CommandResult>> pending = new HashMap<>();
  private ConnectionState state = ConnectionState.DISCONNECTED;
  private WebSocketSession session;
  private CompletableFuture<Void> connectAttempt;
  private CompletableFuture<Void> ready = new CompletableFuture<>();
  private TimerHandle handshakeTimer;
  private TimerHandle reconnectTimer;
  private int nextId = 1;
  private boolean upstreamSubscribed;
  private boolean upstreamSubscribing;
  private boolean authRejected;

  public WebSocketStateTransport(
      HomeAssistantConnection connection,
      TransportProperties properties,
      WebSocketClient webSocketClient,
      HaMessageCodec codec,
      ObjectMapper objectMapper,
      TransportTimers timers,
      SubscriptionRegistry subscriptions,
      ZoneConfiguratorMetrics metrics) {
    this.connection = connection;
    this.properties = properties;
    this.webSocketClient = webSocketClient;
    this.codec = codec;
    this.objectMapper = objectMapper;
    this.timers = timers;
    this.subscriptions = subscriptions;
    this.metrics = metrics;
  }

  @Override
  public TransportKind kind() {
    return TransportKind.WEBSOCKET;
  }

  @Override
  public CompletableFuture<Void> connect() {
    final CompletableFuture<Void> attempt;
    synchronized (lock) {
      if (state == ConnectionState.READY) {
        return CompletableFuture.completedFuture(null);
      }
      if (connectAttempt != null && !connectAttempt.isDone()) {
        return connectAttempt;
      }
      if (ready.isCompletedExceptionally()) {
        ready = new CompletableFuture<>();
      }
      authRejected = false;
      cancel(reconnectTimer);
      reconnectTimer = null;
      state = ConnectionState.CONNECTING;
      attempt = new CompletableFuture<>();
      connectAttempt = attempt;
      handshakeTimer =
          timers.schedule(properties.handshakeTimeout(), () -> onHandshakeTimeout(attempt));
    }
    final URI uri = connection.webSocketUri();
    logger.info("home assistant websocket connecting url={}", uri);
    try {
      webSocketClient
          .execute(new UpstreamHandler(attempt), new WebSocketHttpHeaders(), uri)
          .whenComplete(
              (opened, ex) -> {
                if (ex != null) {
                  onConnectionLost(
                      attempt,
                      new HomeAssistantTransportException(
                          HomeAssistantTransportException.Reason.CONNECTION,
                          "WebSocket connection failed: " + unwrap(ex).getMessage(),
                          unwrap(ex)),
                      "handshake failed");
                }
              });
    } catch (RuntimeException ex) {
      onConnectionLost(
          attempt,
          new HomeAssistantTransportException(
              HomeAssistantTransportException.Reason.CONNECTION,
              "WebSocket connection failed: " + ex.getMessage(),
              ex),
          "handshake failed");
    }
    return attempt;
  }

  @Override
  public void disconnect() {
    final CompletableFuture<Void> attempt;
    final CompletableFuture<Void> waiting;
    synchronized (lock) {
      state = ConnectionState.CLOSED;
      cancel(reconnectTimer);
      reconnectTimer = null;
      attempt = connectAttempt;
      if (ready.isDone() && !ready.isCompletedExceptionally()) {
        ready = new CompletableFuture<>();
      }
      waiting = ready;
    }
    logger.info("home assistant websocket disconnect requested");
    if (attempt != null) {
      onConnectionLost(
          attempt,
          new HomeAssistantTransportException(
              HomeAssistantTransportException.Reason.CONNECTION_CLOSED, "WebSocket disconnected"),
          "disconnect requested");
    }
    waiting.completeExceptionally(
        new HomeAssistantTransportException(
            HomeAssistantTransportException.Reason.CONNECTION_CLOSED, "WebSocket disconnected"));
  }

  @Override
  public boolean isConnected() {
    synchronized (lock) {
      return state == ConnectionState.READY;
    }
  }

  public ConnectionState connectionState() {
    synchronized (lock) {
      return state;
    }
  }

  // 要求タイムアウトは認証待ちと応答待ちの両方を含む
  public CompletableFuture<CommandResult> call(Map<String, ?> command) {
    return call(command, true);
  }

  private CompletableFuture<CommandResult> call(Map<String, ?> command, boolean waitForReady) {
    final CompletableFuture<CommandResult> result = new CompletableFuture<>();
    final TimerHandle timeout =
        timers.schedule(properties.requestTimeout(), () -> expire(result, command));
    result.whenComplete((ignored, ex) -> timeout.cancel());
    sendWhenReady(command, result, waitForReady);
    return result;
  }

  @Override
  public Optional<StateRecord> getState(String entityId) {
    return Optional.ofNullable(getStates(List.of(entityId)).get(entityId));
  }

  @Override
  public Map<String, StateRecord> getStates(Collection<String> entityIds) {
    final Set<String> wanted = Set.copyOf(entityIds);
    final Map<String, StateRecord> found = new LinkedHashMap<>();
    for (StateRecord record : getAllStates()) {
      if (wanted.contains(record.entityId())) {
        found.put(record.entityId(), record);
      }
    }
    return found;
  }

  @Override
  public List<StateRecord> getAllStates() {
    final JsonNode result = query(Map.of("type", "get_states"), "get_states");
    final List<StateRecord> states = new ArrayList<>();
    if (result != null && result.isArray()) {
      result.forEach(
          node -> {
            final StateRecord record = StateRecord.fromJson(node);
            if (record != null) {
              states.add(record);
            }
          });
    }
    return states;
  }

  @Override
  public List<DeviceRegistryEntry> listDevices() {
    return convert(
        query(Map.of("type", "config/device_registry/list"), "device_registry"),
        new TypeReference<List<DeviceRegistryEntry>>() {});
  }

  @Override
  public List<EntityRegistryEntry> listEntityRegistry() {
    return convert(
        query(Map.of("type", "config/entity_registry/list"), "entity_registry"),
        new TypeReference<List<EntityRegistryEntry>>() {});
  }

  @Override
  public List<AreaRegistryEntry> listAreaRegistry() {
    return convert(
        query(Map.of("type", "config/area_registry/list"), "area_registry"),
        new TypeReference<List<AreaRegistryEntry>>() {});
  }

  @Override
  public List<String> getServicesForTarget(Map<String, Object> target, boolean expandGroup) {
    final Map<String, Object> command = new LinkedHashMap<>();
    command.put("type", "get_services_for_target");
    command.put("target", target == null ? Map.of() : target);
    command.put("expand_group", expandGroup);
    return convert(
        query(command, "get_services_for_target"), new TypeReference<List<String>>() {});
  }

  @Override
  public List<String> getServicesByDomain(String domain) {
    final JsonNode result = query(Map.of("type", "get_services"), "get_services");
    if (result == null || !result.path(domain).isObject()) {
      return List.of();
    }
    final List<String> services = new ArrayList<>();
    result.path(domain).fieldNames().forEachRemaining(services::add);
    services.sort(String::compareTo);
    return services;
  }

  @Override
  public String subscribeToStateChanges(
      Collection<String> entityIds, StateChangeListener listener) {
    final SubscriptionRegistry.Subscription subscription =
        subscriptions.register(entityIds, listener);
    logger.info(
        "state subscription registered subscriptionId={} entityCount={}",
        subscription.id(),
        subscription.entityIds().size());
    activateStateSubscription();
    return subscription.id();
  }

  @Override
  public void unsubscribe(String subscriptionId) {
    if (subscriptions.remove(subscriptionId)) {
      logger.info("state subscription removed subscriptionId={}", subscriptionId);
    }
  }

  @Override
  public void unsubscribeAll() {
    subscriptions.clear();
    logger.info("all state subscriptions removed");
  }

  @VisibleForTesting
  boolean isUpstreamSubscribed() {
    synchronized (lock) {
      return upstreamSubscribed;
    }
  }

  private void activateStateSubscription() {
    synchronized (lock) {
      if (state != ConnectionState.READY || upstreamSubscribed || upstreamSubscribing) {
        return;
      }
      upstreamSubscribing = true;
    }
    call(Map.of("type", "subscribe_events", "event_type", "state_changed"), false)
        .whenComplete(
            (result, ex) -> {
              final boolean accepted = ex == null && result.success();
              synchronized (lock) {
                upstreamSubscribing = false;
                upstreamSubscribed = accepted && state == ConnectionState.READY;
              }
              if (ex != null) {
                logger.error("state_changed subscription failed", unwrap(ex));
              } else if (!accepted) {
                logger.error(
                    "state_changed subscription rejected error={}", result.errorMessage());
              } else {
                logger.info("subscribed to state_changed events");
              }
            });
  }

  private void sendWhenReady(
      Map<String, ?> command, CompletableFuture<CommandResult> result, boolean waitForReady) {
    final CompletableFuture<Void> readiness;
    synchronized (lock) {
      readiness = ready;
    }
    if (!waitForReady && !readiness.isDone()) {
      result.completeExceptionally(
          new HomeAssistantTransportException(
              HomeAssistantTransportException.Reason.CONNECTION_CLOSED,
              "WebSocket is not connected"));
      return;
    }
    readiness.whenComplete(
        (ignored, ex) -> {
          if (ex != null) {
            result.completeExceptionally(unwrap(ex));
          } else if (!result.isDone()) {
            send(command, result, waitForReady);
          }
        });
  }

  private void send(
      Map<String, ?> command, CompletableFuture<CommandResult> result, boolean waitForReady) {
    final int id;
    final WebSocketSession target;
    final boolean closed;
    synchronized (lock) {
      closed = state == ConnectionState.CLOSED;
      if (closed || state != ConnectionState.READY || session == null) {
        target = null;
        id = 0;
      } else {
        id = nextId++;
        pending.put(id, result);
        target = session;
      }
    }
    if (closed) {
      result.completeExceptionally(
          new HomeAssistantTransportException(
              HomeAssistantTransportException.Reason.CONNECTION_CLOSED, "WebSocket disconnected"));
      return;
    }
    if (target == null) {
      // 再接続待ちの間に切断された
      sendWhenReady(command, result, waitForReady);
      return;
    }
    try {
      target.sendMessage(new TextMessage(codec.encodeCommand(id, command)));
    } catch (IOException | RuntimeException ex) {
      synchronized (lock) {
        pending.remove(id);
      }
      logger.warn("home assistant websocket send failed id={} type={}", id, command.get("type"));
      result.completeExceptionally(
          new HomeAssistantTransportException(
              HomeAssistantTransportException.Reason.CONNECTION,
              "failed to send command: " + ex.getMessage(),
              ex));
    }
  }

  private void expire(CompletableFuture<CommandResult> result, Map<String, ?> command) {
    synchronized (lock) {
      final Iterator<CompletableFuture<CommandResult>> iterator = pending.values().iterator();
      while (iterator.hasNext()) {
        if (iterator.next() == result) {
          iterator.remove();
        }
      }
    }
    if (result.completeExceptionally(
        new HomeAssistantTransportException(
            HomeAssistantTransportException.Reason.REQUEST_TIMEOUT,
            "Request timeout: " + command.get("type")))) {
      logger.warn(
          "home assistant websocket request timed out type={} timeout={}",
          command.get("type"),
          properties.requestTimeout());
      metrics.recordRequestTimeout();
    }
  }

  private JsonNode query(Map<String, ?> command, String operation) {
    final CommandResult result = await(call(command));
    if (!result.success()) {
      logger.warn(
          "home assistant websocket {} unsuccessful error={}", operation, result.errorMessage());
      return null;
    }
    return result.result();
  }

  private <T> List<T> convert(JsonNode node, TypeReference<List<T>> type) {
    if (node == null || !node.isArray()) {
      return List.of();
    }
    try {
      return objectMapper.convertValue(node, type);
    } catch (IllegalArgumentException ex) {
      throw new HomeAssistantTransportException(
          HomeAssistantTransportException.Reason.INVALID_RESPONSE,
          "home assistant response could not be mapped",
          ex);
    }
  }

  private CommandResult await(CompletableFuture<CommandResult> future) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      final Throwable cause = unwrap(ex);
      if (cause instanceof HomeAssistantTransportException transportException) {
        throw transportException;
      }
      throw new HomeAssistantTransportException(
          HomeAssistantTransportException.Reason.CONNECTION, "home assistant call failed", cause);
    }
  }

  private void onOpened(CompletableFuture<Void> attempt, WebSocketSession opened) {
    final boolean current;
    synchronized (lock) {
      current = connectAttempt == attempt && state == ConnectionState.CONNECTING;
      if (current) {
        session =
            new ConcurrentWebSocketSessionDecorator(
                opened, SEND_TIME_LIMIT_MILLIS, SEND_BUFFER_LIMIT_BYTES);
        state = ConnectionState.AWAITING_AUTH;
      }
    }
    if (!current) {
      logger.debug("closing superseded home assistant websocket sessionId={}", opened.getId());
      closeQuietly(opened);
      return;
    }
    logger.info("home assistant websocket opened, awaiting auth_required");
  }

  private void onMessage(CompletableFuture<Void> attempt, String payload) {
    synchronized (lock) {
      if (connectAttempt != attempt) {
        return;
      }
    }
    final Optional<HaInboundMessage> decoded = codec.decode(payload);
    if (decoded.isEmpty()) {
      return;
    }
    final HaInboundMessage message = decoded.get();
    if (message instanceof HaInboundMessage.AuthRequired) {
      sendAuth(attempt);
    } else if (message instanceof HaInboundMessage.AuthOk authOk) {
      onAuthenticated(attempt, authOk.haVersion());
    } else if (message instanceof HaInboundMessage.AuthInvalid authInvalid) {
      onAuthRejected(attempt, authInvalid.message());
    } else if (message instanceof HaInboundMessage.Result result) {
      onResult(result);
    } else if (message instanceof HaInboundMessage.Event event) {
      onEvent(event);
    }
  }

  private void sendAuth(CompletableFuture<Void> attempt) {
    final WebSocketSession target;
    synchronized (lock) {
      target = session;
    }
    if (target == null) {
      return;
    }
    logger.debug("sending home assistant auth");
    try {
      target.sendMessage(new TextMessage(codec.encodeAuth(connection.token())));
    } catch (IOException | RuntimeException ex) {
      onConnectionLost(
          attempt,
          new HomeAssistantTransportException(
              HomeAssistantTransportException.Reason.CONNECTION, "failed to send auth", ex),
          "auth send failed");
    }
  }

  private void onAuthenticated(CompletableFuture<Void> attempt, String haVersion) {
    final CompletableFuture<Void> readiness;
    final boolean resubscribe;
    synchronized (lock) {
      if (connectAttempt != attempt || state != ConnectionState.AWAITING_AUTH) {
        return;
      }
      cancel(handshakeTimer);
      handshakeTimer = null;
      state = ConnectionState.READY;
      readiness = ready;
      resubscribe = !subscriptions.isEmpty();
    }
    logger.info("home assistant websocket authenticated haVersion={}", haVersion);
    attempt.complete(null);
    readiness.complete(null);
    if (resubscribe) {
      activateStateSubscription();
    }
  }

  private void onAuthRejected(CompletableFuture<Void> attempt, String reason) {
    final HomeAssistantTransportException failure =
        new HomeAssistantTransportException(
            HomeAssistantTransportException.Reason.AUTH, "Auth invalid: " + reason);
    final CompletableFuture<Void> readiness;
    synchronized (lock) {
      if (connectAttempt != attempt) {
        return;
      }
      authRejected = true;
      readiness = ready;
    }
    logger.error("home assistant websocket auth rejected reason={}", reason);
    readiness.completeExceptionally(failure);
    onConnectionLost(attempt, failure, "auth rejected");
  }

  private void onHandshakeTimeout(CompletableFuture<Void> attempt) {
    synchronized (lock) {
      if (connectAttempt != attempt || state == ConnectionState.READY) {
        return;
      }
    }
    logger.error(
        "home assistant websocket handshake timed out timeout={}", properties.handshakeTimeout());
    onConnectionLost(
        attempt,
        new HomeAssistantTransportException(
            HomeAssistantTransportException.Reason.TIMEOUT, "WebSocket connection timeout"),
        "handshake timeout");
  }

  private void onResult(HaInboundMessage.Result result) {
    final CompletableFuture<CommandResult> waiting;
    synchronized (lock) {
      waiting = pending.remove(result.id());
    }
    if (waiting == null) {
      logger.debug("dropping result for unknown request id={}", result.id());
      return;
    }
    waiting.complete(
        new CommandResult(result.id(), result.success(), result.result(), result.error()));
  }

  private void onEvent(HaInboundMessage.Event event) {
    if (!"state_changed".equals(event.eventType())) {
      return;
    }
    final JsonNode data = event.data();
    final String entityId = data.path("entity_id").asText("");
    if (entityId.isBlank()) {
      return;
    }
    subscriptions.dispatch(
        entityId, StateRecord.fromJson(data.get("new_state")), StateRecord.fromJson(data.get("old_state")));
  }

  // attempt ごとに一度だけ実行される
  private void onConnectionLost(
      CompletableFuture<Void> attempt, HomeAssistantTransportException cause, String description) {
    final List<CompletableFuture<CommandResult>> interrupted;
    final WebSocketSession toClose;
    final boolean reconnect;
    synchronized (lock) {
      if (connectAttempt != attempt) {
        return;
      }
      connectAttempt = null;
      cancel(handshakeTimer);
      handshakeTimer = null;
      toClose = session;
      session = null;
      nextId = 1;
      upstreamSubscribed = false;
      upstreamSubscribing = false;
      interrupted = new ArrayList<>(pending.values());
      pending.clear();
      if (ready.isDone() && !ready.isCompletedExceptionally()) {
        ready = new CompletableFuture<>();
      }
      reconnect = state != ConnectionState.CLOSED && !authRejected;
      if (state != ConnectionState.CLOSED) {
        state = ConnectionState.DISCONNECTED;
      }
      if (reconnect) {
        scheduleReconnect();
      }
    }
    logger.warn(
        "home assistant websocket connection lost reason={} pendingRequests={} reconnect={}",
        description,
        interrupted.size(),
        reconnect);
    final HomeAssistantTransportException closed =
        new HomeAssistantTransportException(
            HomeAssistantTransportException.Reason.CONNECTION_CLOSED, "WebSocket connection closed");
    interrupted.forEach(request -> request.completeExceptionally(closed));
    attempt.completeExceptionally(cause);
    closeQuietly(toClose);
  }

  // lock 保持中に呼ぶこと
  private void scheduleReconnect() {
    if (reconnectTimer != null && reconnectTimer.isActive()) {
      return;
    }
    logger.info("home assistant websocket reconnect scheduled delay={}", properties.reconnectDelay());
    reconnectTimer = timers.schedule(properties.reconnectDelay(), this::reconnect);
  }

  private void reconnect() {
    synchronized (lock) {
      reconnectTimer = null;
      if (state == ConnectionState.CLOSED || authRejected) {
        return;
      }
    }
    metrics.recordReconnectAttempt();
    logger.info("home assistant websocket reconnecting");
    connect()
        .whenComplete(
            (ignored, ex) -> {
              if (ex != null) {
                logger.warn("home assistant websocket reconnect failed reason={}", unwrap(ex).getMessage());
              }
            });
  }

  private static void cancel(TimerHandle handle) {
    if (handle != null) {
      handle.cancel();
    }
  }

  private static void closeQuietly(WebSocketSession target) {
    if (target == null || !target.isOpen()) {
      return;
    }
    try {
      target.close(CloseStatus.NORMAL);
    } catch (IOException ex) {
      logger.debug("home assistant websocket close failed sessionId={}", target.getId(), ex);
    }
  }

  private static Throwable unwrap(Throwable ex) {
    Throwable current = ex;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private final class UpstreamHandler extends TextWebSocketHandler {

    private final CompletableFuture<Void> attempt;

    private UpstreamHandler(CompletableFuture<Void> attempt) {
      this.attempt = attempt;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession opened) {
      onOpened(attempt, opened);
    }

    @Override
    protected void handleTextMessage(WebSocketSession source, TextMessage message) {
      onMessage(attempt, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession source, Throwable exception) {
      logger.error("home assistant websocket transport error", exception);
      onConnectionLost(
          attempt,
          new HomeAssistantTransportException(
              HomeAssistantTransportException.Reason.CONNECTION,
              "WebSocket error: " + exception.getMessage(),
              exception),
          "transport error");
    }

    @Override
    public void afterConnectionClosed(WebSocketSession source, CloseStatus status) {
      onConnectionLost(
          attempt,
          new HomeAssistantTransportException(
              HomeAssistantTransportException.Reason.CONNECTION,
              "WebSocket closed before authentication: " + status),
          "closed code=" + status.getCode());
    }
  }
}
