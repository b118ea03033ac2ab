package com.mmwave.zone_configurator.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mmwave.zone_configurator.config.HomeAssistantConnection;
import com.mmwave.zone_configurator.config.TransportProperties;
import com.mmwave.zone_configurator.service.ZoneConfiguratorMetrics;
import com.mmwave.zone_configurator.transport.message.HaMessageCodec;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import org.springframework.web.client.RestClient;
import org.springframework.web.socket.client.WebSocketClient;

@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "各クライアントは Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class StateTransportFactory {

  private final HomeAssistantConnection connection;
  private final TransportProperties properties;
  private final WebSocketClient webSocketClient;
  private final RestClient homeAssistantRestClient;
  private final ObjectMapper objectMapper;
  private final TransportTimers timers;
  private final Executor deliveryExecutor;
  private final ZoneConfiguratorMetrics metrics;

  public WebSocketStateTransport createWebSocketTransport() {
    return new WebSocketStateTransport(
        connection,
        properties,
        webSocketClient,
        new HaMessageCodec(objectMapper),
        objectMapper,
        timers,
        new SubscriptionRegistry("websocket", deliveryExecutor, metrics),
        metrics);
  }

  public RestStateTransport createRestTransport() {
    return new RestStateTransport(
        homeAssistantRestClient,
        properties,
        objectMapper,
        timers,
        new SubscriptionRegistry("rest", deliveryExecutor, metrics),
        metrics);
  }
}
