package com.mmwave.zone_configurator.model;

public enum TransportKind {
  WEBSOCKET("websocket"),
  REST("rest");

  private final String value;

  TransportKind(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
