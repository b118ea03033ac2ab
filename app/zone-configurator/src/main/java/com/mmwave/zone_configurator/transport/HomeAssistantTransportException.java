package com.mmwave.zone_configurator.transport;

public class HomeAssistantTransportException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final Reason reason;

  public HomeAssistantTransportException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public HomeAssistantTransportException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public enum Reason {
    CONNECTION,
    // 自動再試行しない
    AUTH,
    TIMEOUT,
    REQUEST_TIMEOUT,
    CONNECTION_CLOSED,
    REJECTED,
    INVALID_RESPONSE
  }
}
