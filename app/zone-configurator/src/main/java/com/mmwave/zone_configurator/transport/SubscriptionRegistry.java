/*
 * どこで: Zone Configurator トランスポート共通
 * 何を: 購読の登録と、購読ごとの直列 executor への state 変化の振り分け
 * なぜ: 遅い・失敗するリスナーが他の購読者の配信を止めないようにするため
 */
package com.mmwave.zone_configurator.transport;

import com.google.common.util.concurrent.MoreExecutors;
import com.mmwave.common.Ids;
import com.mmwave.zone_configurator.model.StateRecord;
import com.mmwave.zone_configurator.service.ZoneConfiguratorMetrics;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SubscriptionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

  private final String transport;
  private final Executor deliveryExecutor;
  private final ZoneConfiguratorMetrics metrics;
  private final ConcurrentMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();

  public SubscriptionRegistry(
      String transport, Executor deliveryExecutor, ZoneConfiguratorMetrics metrics) {
    this.transport = transport;
    this.deliveryExecutor = deliveryExecutor;
    this.metrics = metrics;
  }

  // entityIds が空なら全エンティティ
  public Subscription register(Collection<String> entityIds, StateChangeListener listener) {
    if (listener == null) {
      throw new IllegalArgumentException("listener is required");
    }
    final Subscription subscription =
        new Subscription(
            Ids.newSubscriptionId(),
            entityIds == null ? Set.of() : Set.copyOf(entityIds),
            listener,
            MoreExecutors.newSequentialExecutor(deliveryExecutor));
    subscriptions.put(subscription.id(), subscription);
    return subscription;
  }

  public boolean remove(String subscriptionId) {
    return subscriptionId != null && subscriptions.remove(subscriptionId) != null;
  }

  public void clear() {
    subscriptions.clear();
  }

  public boolean isEmpty() {
    return subscriptions.isEmpty();
  }

  public int size() {
    return subscriptions.size();
  }

  public Optional<Subscription> find(String subscriptionId) {
    return Optional.ofNullable(subscriptions.get(subscriptionId));
  }

  public List<Subscription> active() {
    return List.copyOf(subscriptions.values());
  }

  public int dispatch(String entityId, StateRecord newState, StateRecord previousState) {
    int matched = 0;
    for (Subscription subscription : subscriptions.values()) {
      if (subscription.matches(entityId)) {
        subscription.deliver(entityId, newState, previousState);
        matched++;
      }
    }
    return matched;
  }

  public final class Subscription {

    private final String id;
    private final Set<String> entityIds;
    private final StateChangeListener listener;
    private final Executor serialExecutor;
    private final ConcurrentMap<String, Instant> lastDelivered = new ConcurrentHashMap<>();

    private Subscription(
        String id, Set<String> entityIds, StateChangeListener listener, Executor serialExecutor) {
      this.id = id;
      this.entityIds = entityIds;
      this.listener = listener;
      this.serialExecutor = serialExecutor;
    }

    public String id() {
      return id;
    }

    public Set<String> entityIds() {
      return entityIds;
    }

    public boolean wantsAll() {
      return entityIds.isEmpty();
    }

    public boolean matches(String entityId) {
      return entityId != null && (entityIds.isEmpty() || entityIds.contains(entityId));
    }

    public void deliver(String entityId, StateRecord newState, StateRecord previousState) {
      serialExecutor.execute(() -> invoke(entityId, newState, previousState));
    }

    private void invoke(String entityId, StateRecord newState, StateRecord previousState) {
      if (!subscriptions.containsKey(id)) {
        return;
      }
      if (isStale(entityId, newState)) {
        logger.debug(
            "dropping out-of-order state subscriptionId={} entityId={} lastChanged={}",
            id,
            entityId,
            newState.lastChanged());
        return;
      }
      try {
        listener.onStateChange(entityId, newState, previousState);
      } catch (RuntimeException ex) {
        logger.error(
            "state change listener failed transport={} subscriptionId={} entityId={}",
            transport,
            id,
            entityId,
            ex);
        metrics.recordSubscriberError(transport);
      }
    }

    private boolean isStale(String entityId, StateRecord newState) {
      if (newState == null || newState.lastChanged() == null) {
        return false;
      }
      final Instant previous = lastDelivered.get(entityId);
      if (previous != null && newState.lastChanged().isBefore(previous)) {
        return true;
      }
      lastDelivered.put(entityId, newState.lastChanged());
      return false;
    }
  }
}
