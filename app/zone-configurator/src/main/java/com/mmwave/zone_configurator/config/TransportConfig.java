/*
 * どこで: Zone Configurator 設定
 * 何を: HA 接続情報・RestClient・WebSocketClient・transport 選択結果を Bean として提供する
 * なぜ: 起動時に一度だけ read transport を決定し、アプリ全体で共有するため
 */
package com.mmwave.zone_configurator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mmwave.zone_configurator.service.ZoneConfiguratorMetrics;
import com.mmwave.zone_configurator.transport.StateTransport;
import com.mmwave.zone_configurator.transport.StateTransportFactory;
import com.mmwave.zone_configurator.transport.TaskSchedulerTransportTimers;
import com.mmwave.zone_configurator.transport.TransportSelection;
import com.mmwave.zone_configurator.transport.TransportSelector;
import com.mmwave.zone_configurator.transport.TransportStatus;
import com.mmwave.zone_configurator.transport.TransportTimers;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

@Configuration
public class TransportConfig {

  @Bean
  HomeAssistantConnection homeAssistantConnection(HomeAssistantProperties properties) {
    return properties.resolve();
  }

  @Bean
  RestClient homeAssistantRestClient(
      RestClient.Builder builder, HomeAssistantConnection connection) {
    return builder
        .baseUrl(connection.baseUrl())
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + connection.token())
        .build();
  }

  @Bean
  WebSocketClient homeAssistantWebSocketClient(TransportProperties properties) {
    final WebSocketContainer container = ContainerProvider.getWebSocketContainer();
    container.setDefaultMaxTextMessageBufferSize(properties.maxMessageBytes());
    return new StandardWebSocketClient(container);
  }

  @Bean(destroyMethod = "shutdown")
  TaskSchedulerTransportTimers transportTimers(TransportProperties properties, Clock clock) {
    return new TaskSchedulerTransportTimers(properties.timerThreads(), clock);
  }

  @Bean(destroyMethod = "shutdown")
  ExecutorService stateDeliveryExecutor(TransportProperties properties) {
    return Executors.newFixedThreadPool(
        properties.deliveryThreads(),
        new ThreadFactoryBuilder().setNameFormat("ha-state-delivery-%d").setDaemon(true).build());
  }

  @Bean
  StateTransportFactory stateTransportFactory(
      HomeAssistantConnection connection,
      TransportProperties properties,
      WebSocketClient homeAssistantWebSocketClient,
      RestClient homeAssistantRestClient,
      ObjectMapper objectMapper,
      TransportTimers transportTimers,
      ExecutorService stateDeliveryExecutor,
      ZoneConfiguratorMetrics metrics) {
    return new StateTransportFactory(
        connection,
        properties,
        homeAssistantWebSocketClient,
        homeAssistantRestClient,
        objectMapper,
        transportTimers,
        stateDeliveryExecutor,
        metrics);
  }

  @Bean
  TransportSelection transportSelection(
      StateTransportFactory factory,
      TransportProperties properties,
      ExecutorService stateDeliveryExecutor) {
    return new TransportSelector(factory, properties, stateDeliveryExecutor).select();
  }

  @Bean(destroyMethod = "disconnect")
  StateTransport stateTransport(TransportSelection selection) {
    return selection.transport();
  }

  @Bean
  TransportStatus transportStatus(TransportSelection selection) {
    return selection.status();
  }
}
