package com.mmwave.zone_configurator.transport;

import com.mmwave.zone_configurator.model.AreaRegistryEntry;
import com.mmwave.zone_configurator.model.DeviceRegistryEntry;
import com.mmwave.zone_configurator.model.EntityRegistryEntry;
import com.mmwave.zone_configurator.model.StateRecord;
import com.mmwave.zone_configurator.model.TransportKind;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface StateTransport {

  TransportKind kind();

  CompletableFuture<Void> connect();

  void disconnect();

  boolean isConnected();

  Optional<StateRecord> getState(String entityId);

  /**
   * 役割: 指定エンティティの現在状態をまとめて取得する。
   * 動作: 存在するエンティティのみを返し、存在しないものは結果から除く (エラーにしない)。
   * 前提: 呼び出し元スレッドをブロックする。転送失敗時は HomeAssistantTransportException を送出する。
   */
  Map<String, StateRecord> getStates(Collection<String> entityIds);

  List<StateRecord> getAllStates();

  List<DeviceRegistryEntry> listDevices();

  List<EntityRegistryEntry> listEntityRegistry();

  List<AreaRegistryEntry> listAreaRegistry();

  List<String> getServicesForTarget(Map<String, Object> target, boolean expandGroup);

  // サービス名の昇順
  List<String> getServicesByDomain(String domain);

  /**
   * 役割: エンティティの状態変化を購読する。
   * 動作: entityIds が空なら全エンティティを対象とし、unsubscribe に渡す購読 ID を返す。
   * 前提: listener は null でないこと。通知は購読ごとに配信順が保たれる。
   */
  String subscribeToStateChanges(Collection<String> entityIds, StateChangeListener listener);

  void unsubscribe(String subscriptionId);

  void unsubscribeAll();
}
