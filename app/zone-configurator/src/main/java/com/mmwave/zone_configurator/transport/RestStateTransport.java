/*
 * どこで: Zone Configurator 読み取りトランスポート (REST)
 * 何を: HA REST API をポーリングし、購読ごとのスナップショット差分で state 変化を通知する
 * なぜ: WebSocket が使えない環境でも同じ購読インタフェースを提供するため
 */
package com.mmwave.zone_configurator.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.mmwave.zone_configurator.config.TransportProperties;
import com.mmwave.zone_configurator.model.AreaRegistryEntry;
import com.mmwave.zone_configurator.model.DeviceRegistryEntry;
import com.mmwave.zone_configurator.model.EntityRegistryEntry;
import com.mmwave.zone_configurator.model.StateRecord;
import com.mmwave.zone_configurator.model.TransportKind;
import com.mmwave.zone_configurator.service.ZoneConfiguratorMetrics;
import com.mmwave.zone_configurator.transport.TransportTimers.TimerHandle;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

public class RestStateTransport implements StateTransport {

  private static final Logger logger = LoggerFactory.getLogger(RestStateTransport.class);

  static final String DEVICE_REGISTRY_TEMPLATE =
      """
      {% set devices = namespace(list=[]) %}
      {% set seen = namespace(ids=[]) %}
      {% for state in states %}
        {% set dev_id = device_id(state.entity_id) %}
        {% if dev_id and dev_id not in seen.ids %}
          {% set seen.ids = seen.ids + [dev_id] %}
          {% set dev_identifiers = device_attr(dev_id, 'identifiers') %}
          {% set devices.list = devices.list + [{
            'id': dev_id,
            'name': device_attr(dev_id, 'name'),
            'name_by_user': device_attr(dev_id, 'name_by_user'),
            'manufacturer': device_attr(dev_id, 'manufacturer'),
            'model': device_attr(dev_id, 'model'),
            'sw_version': device_attr(dev_id, 'sw_version'),
            'hw_version': device_attr(dev_id, 'hw_version'),
            'area_id': device_attr(dev_id, 'area_id'),
            'identifiers': dev_identifiers | list if dev_identifiers else []
          }] %}
        {% endif %}
      {% endfor %}
      {{ devices.list | tojson }}
      """;

  static final String ENTITY_REGISTRY_TEMPLATE =
      """
      {% set entities = namespace(list=[]) %}
      {% for state in states %}
        {% set entities.list = entities.list + [{
          'entity_id': state.entity_id,
          'device_id': device_id(state.entity_id),
          'platform': state.attributes.get('platform', ''),
          'disabled_by': none,
          'hidden_by': none
        }] %}
      {% endfor %}
      {{ entities.list | tojson }}
      """;

  static final String AREA_REGISTRY_TEMPLATE =
      """
      {% set areas = namespace(list=[]) %}
      {% for area in areas() %}
        {% set areas.list = areas.list + [{
          'area_id': area,
          'name': area_name(area),
          'floor_id': none,
          'icon': none
        }] %}
      {% endfor %}
      {{ areas.list | tojson }}
      """;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient homeAssistantRestClient;

  private final TransportProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final TransportTimers timers;
  private final SubscriptionRegistry subscriptions;
  private final ZoneConfiguratorMetrics metrics;
  private final ConcurrentMap<String, Map<String, StateRecord>> lastKnownStates =
      new ConcurrentHashMap<>();
  private final Object pollLock = new Object();
  private TimerHandle pollTimer;
  private volatile boolean connected;

  public RestStateTransport(
      RestClient homeAssistantRestClient,
      TransportProperties properties,
      ObjectMapper objectMapper,
      TransportTimers timers,
      SubscriptionRegistry subscriptions,
      ZoneConfiguratorMetrics metrics) {
    this.homeAssistantRestClient = homeAssistantRestClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.timers = timers;
    this.subscriptions = subscriptions;
    this.metrics = metrics;
  }

  @Override
  public TransportKind kind() {
    return TransportKind.REST;
  }

  @Override
  public CompletableFuture<Void> connect() {
    try {
      homeAssistantRestClient.get().uri("/").retrieve().toBodilessEntity();
      connected = true;
      logger.info("home assistant rest api reachable");
      return CompletableFuture.completedFuture(null);
    } catch (RestClientResponseException ex) {
      logger.error(
          "home assistant rest health check failed status={}", ex.getStatusCode().value());
      final HomeAssistantTransportException.Reason reason =
          ex.getStatusCode().value() == 401 || ex.getStatusCode().value() == 403
              ? HomeAssistantTransportException.Reason.AUTH
              : HomeAssistantTransportException.Reason.CONNECTION;
      return CompletableFuture.failedFuture(
          new HomeAssistantTransportException(
              reason, "REST API health check failed: " + ex.getStatusCode().value(), ex));
    } catch (ResourceAccessException ex) {
      return CompletableFuture.failedFuture(mapResourceException(ex, "connect"));
    } catch (RestClientException ex) {
      logger.error("home assistant rest health check failed", ex);
      return CompletableFuture.failedFuture(
          new HomeAssistantTransportException(
              HomeAssistantTransportException.Reason.CONNECTION, "REST API health check failed", ex));
    }
  }

  // 例外を投げない
  public boolean ping() {
    try {
      homeAssistantRestClient.get().uri("/").retrieve().toBodilessEntity();
      return true;
    } catch (RestClientException ex) {
      logger.debug("home assistant rest ping failed", ex);
      return false;
    }
  }

  @Override
  public void disconnect() {
    stopPolling();
    connected = false;
    logger.info("home assistant rest transport disconnected");
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  @Override
  public Optional<StateRecord> getState(String entityId) {
    try {
      return Optional.ofNullable(
          StateRecord.fromJson(
              homeAssistantRestClient
                  .get()
                  .uri("/states/{entityId}", entityId)
                  .retrieve()
                  .body(JsonNode.class)));
    } catch (HttpClientErrorException.NotFound ex) {
      return Optional.empty();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "getState");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "getState");
    }
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
    final JsonNode body;
    try {
      body = homeAssistantRestClient.get().uri("/states").retrieve().body(JsonNode.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "getAllStates");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "getAllStates");
    }
    if (body == null || !body.isArray()) {
      throw new HomeAssistantTransportException(
          HomeAssistantTransportException.Reason.INVALID_RESPONSE, "states response is not a list");
    }
    final List<StateRecord> states = new ArrayList<>();
    body.forEach(
        node -> {
          final StateRecord record = StateRecord.fromJson(node);
          if (record != null) {
            states.add(record);
          }
        });
    return states;
  }

  @Override
  public List<DeviceRegistryEntry> listDevices() {
    return listRegistry(
        "/config/device_registry",
        DEVICE_REGISTRY_TEMPLATE,
        new TypeReference<List<DeviceRegistryEntry>>() {},
        "device");
  }

  @Override
  public List<EntityRegistryEntry> listEntityRegistry() {
    return listRegistry(
        "/config/entity_registry",
        ENTITY_REGISTRY_TEMPLATE,
        new TypeReference<List<EntityRegistryEntry>>() {},
        "entity");
  }

  @Override
  public List<AreaRegistryEntry> listAreaRegistry() {
    return listRegistry(
        "/config/area_registry",
        AREA_REGISTRY_TEMPLATE,
        new TypeReference<List<AreaRegistryEntry>>() {},
        "area");
  }

  @Override
  public List<String> getServicesForTarget(Map<String, Object> target, boolean expandGroup) {
    logger.debug("getServicesForTarget is not supported over rest");
    return List.of();
  }

  @Override
  public List<String> getServicesByDomain(String domain) {
    logger.debug("getServicesByDomain is not supported over rest domain={}", domain);
    return List.of();
  }

  @Override
  public String subscribeToStateChanges(
      Collection<String> entityIds, StateChangeListener listener) {
    final SubscriptionRegistry.Subscription subscription;
    synchronized (pollLock) {
      subscription = subscriptions.register(entityIds, listener);
      lastKnownStates.put(subscription.id(), new ConcurrentHashMap<>());
      startPolling();
    }
    logger.info(
        "state subscription registered subscriptionId={} entityCount={}",
        subscription.id(),
        subscription.entityIds().size());
    return subscription.id();
  }

  @Override
  public void unsubscribe(String subscriptionId) {
    final boolean removed;
    synchronized (pollLock) {
      removed = subscriptions.remove(subscriptionId);
      lastKnownStates.remove(subscriptionId);
      if (subscriptions.isEmpty()) {
        stopPolling();
      }
    }
    if (removed) {
      logger.info("state subscription removed subscriptionId={}", subscriptionId);
    }
  }

  @Override
  public void unsubscribeAll() {
    synchronized (pollLock) {
      subscriptions.clear();
      lastKnownStates.clear();
      stopPolling();
    }
  }

  @VisibleForTesting
  boolean isPolling() {
    synchronized (pollLock) {
      return pollTimer != null && pollTimer.isActive();
    }
  }

  @VisibleForTesting
  void pollStates() {
    final List<SubscriptionRegistry.Subscription> active = subscriptions.active();
    if (active.isEmpty()) {
      return;
    }
    final Collection<StateRecord> states;
    try {
      states = fetchForPolling(active);
    } catch (HomeAssistantTransportException ex) {
      logger.warn("home assistant polling tick failed reason={}", ex.reason(), ex);
      metrics.recordPollFailure();
      return;
    }
    for (SubscriptionRegistry.Subscription subscription : active) {
      final Map<String, StateRecord> lastKnown = lastKnownStates.get(subscription.id());
      if (lastKnown == null) {
        continue;
      }
      for (StateRecord current : states) {
        if (!subscription.matches(current.entityId())) {
          continue;
        }
        final StateRecord previous = lastKnown.put(current.entityId(), current);
        if (previous == null || hasChanged(previous, current)) {
          subscription.deliver(current.entityId(), current, previous);
        }
      }
    }
  }

  static boolean hasChanged(StateRecord previous, StateRecord current) {
    return !Objects.equals(previous.state(), current.state())
        || !Objects.equals(previous.lastChanged(), current.lastChanged());
  }

  private Collection<StateRecord> fetchForPolling(List<SubscriptionRegistry.Subscription> active) {
    if (active.stream().anyMatch(SubscriptionRegistry.Subscription::wantsAll)) {
      return getAllStates();
    }
    final Set<String> union = new HashSet<>();
    active.forEach(subscription -> union.addAll(subscription.entityIds()));
    return getStates(union).values();
  }

  private void startPolling() {
    synchronized (pollLock) {
      if (pollTimer != null && pollTimer.isActive()) {
        return;
      }
      logger.info("home assistant polling started interval={}", properties.restPollingInterval());
      pollTimer =
          timers.scheduleWithFixedDelay(
              Duration.ZERO, properties.restPollingInterval(), this::pollSafely);
    }
  }

  private void stopPolling() {
    synchronized (pollLock) {
      if (pollTimer == null) {
        return;
      }
      pollTimer.cancel();
      pollTimer = null;
      logger.info("home assistant polling stopped");
    }
  }

  private void pollSafely() {
    try {
      pollStates();
    } catch (RuntimeException ex) {
      logger.error("home assistant polling tick failed unexpectedly", ex);
      metrics.recordPollFailure();
    }
  }

  private <T> List<T> listRegistry(
      String path, String template, TypeReference<List<T>> type, String kind) {
    try {
      final JsonNode body = homeAssistantRestClient.get().uri(path).retrieve().body(JsonNode.class);
      if (body != null && body.isArray()) {
        return objectMapper.convertValue(body, type);
      }
      logger.info("home assistant {} registry endpoint returned no list, using template", kind);
    } catch (RestClientResponseException ex) {
      logger.info(
          "home assistant {} registry endpoint unavailable status={}, using template",
          kind,
          ex.getStatusCode().value());
    } catch (RestClientException | IllegalArgumentException ex) {
      logger.error("home assistant {} registry listing failed", kind, ex);
      return List.of();
    }
    return listRegistryViaTemplate(template, type, kind);
  }

  private <T> List<T> listRegistryViaTemplate(
      String template, TypeReference<List<T>> type, String kind) {
    try {
      final String rendered =
          homeAssistantRestClient
              .post()
              .uri("/template")
              .contentType(MediaType.APPLICATION_JSON)
              .body(Map.of("template", template))
              .retrieve()
              .body(String.class);
      if (rendered == null || rendered.isBlank()) {
        return List.of();
      }
      final List<T> entries = objectMapper.readValue(rendered, type);
      logger.info("home assistant {} registry resolved via template count={}", kind, entries.size());
      return entries;
    } catch (RestClientException | JsonProcessingException ex) {
      logger.warn("home assistant {} registry template query failed", kind, ex);
      return List.of();
    }
  }

  private HomeAssistantTransportException mapResponseException(
      RestClientResponseException ex, String operation) {
    logger.warn(
        "home assistant rest {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().value() == 401 || ex.getStatusCode().value() == 403) {
      return new HomeAssistantTransportException(
          HomeAssistantTransportException.Reason.AUTH, "home assistant rejected credentials", ex);
    }
    return new HomeAssistantTransportException(
        HomeAssistantTransportException.Reason.REJECTED,
        "home assistant rest request failed: " + ex.getStatusCode().value(),
        ex);
  }

  private HomeAssistantTransportException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("home assistant rest {} timed out", operation);
      return new HomeAssistantTransportException(
          HomeAssistantTransportException.Reason.REQUEST_TIMEOUT,
          "home assistant rest request timeout",
          ex);
    }
    logger.warn("home assistant rest {} connection failed", operation, ex);
    return new HomeAssistantTransportException(
        HomeAssistantTransportException.Reason.CONNECTION, "home assistant connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
