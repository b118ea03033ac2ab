package com.mmwave.zone_configurator.api.response;

import java.util.Map;

public record MetaConfigResponse(
    String mode,
    String readTransport,
    String writeTransport,
    TransportAvailability transportStatus,
    Map<String, Object> ha) {

  public record TransportAvailability(String websocket, String rest) {}
}
