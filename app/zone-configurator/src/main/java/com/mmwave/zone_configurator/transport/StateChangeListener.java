package com.mmwave.zone_configurator.transport;

import com.mmwave.zone_configurator.model.StateRecord;

@FunctionalInterface
public interface StateChangeListener {

  // エンティティ削除時は newState が null、前回値不明時は previousState が null
  void onStateChange(String entityId, StateRecord newState, StateRecord previousState);
}
