package com.mmwave.zone_configurator.api;

import com.mmwave.zone_configurator.api.response.HealthResponse;
import com.mmwave.zone_configurator.api.response.MetaConfigResponse;
import com.mmwave.zone_configurator.api.response.MetaHealthResponse;
import com.mmwave.zone_configurator.config.HomeAssistantConnection;
import com.mmwave.zone_configurator.transport.TransportStatus;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class MetaController {

  private final HomeAssistantConnection connection;
  private final TransportStatus transportStatus;
  private final Clock clock;

  @GetMapping("/api/health")
  public HealthResponse health() {
    return new HealthResponse("ok");
  }

  @GetMapping("/api/meta/health")
  public MetaHealthResponse metaHealth() {
    return new MetaHealthResponse(
        "ok",
        connection.mode().value(),
        transportStatus.readTransport().value(),
        clock.instant().toString());
  }

  @GetMapping("/api/meta/config")
  public MetaConfigResponse metaConfig() {
    return new MetaConfigResponse(
        connection.mode().value(),
        transportStatus.readTransport().value(),
        transportStatus.writeTransport().value(),
        new MetaConfigResponse.TransportAvailability(
            availability(transportStatus.webSocketAvailable()),
            availability(transportStatus.restAvailable())),
        connection.redacted());
  }

  private static String availability(boolean available) {
    return available ? "available" : "unavailable";
  }
}
