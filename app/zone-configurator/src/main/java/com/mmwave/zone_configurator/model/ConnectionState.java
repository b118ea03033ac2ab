package com.mmwave.zone_configurator.model;

public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  AWAITING_AUTH,
  READY,
  // 明示的な切断。ここから自動再接続はしない
  CLOSED
}
