package com.mmwave.zone_configurator.transport;

import com.mmwave.zone_configurator.model.TransportKind;

public class TransportStatus {

  private final TransportKind readTransport;
  private final boolean webSocketAvailable;
  private volatile boolean restAvailable;

  public TransportStatus(
      TransportKind readTransport, boolean webSocketAvailable, boolean restAvailable) {
    this.readTransport = readTransport;
    this.webSocketAvailable = webSocketAvailable;
    this.restAvailable = restAvailable;
  }

  public TransportKind readTransport() {
    return readTransport;
  }

  public TransportKind writeTransport() {
    return TransportKind.REST;
  }

  public boolean webSocketAvailable() {
    return webSocketAvailable;
  }

  public boolean restAvailable() {
    return restAvailable;
  }

  void markRestAvailable(boolean available) {
    this.restAvailable = available;
  }
}
