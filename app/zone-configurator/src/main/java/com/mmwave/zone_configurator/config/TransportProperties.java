/*
 * どこで: Zone Configurator 設定
 * 何を: read transport の選択/接続/ポーリング設定を保持する
 * なぜ: タイムアウトや間隔を環境ごとに上書きしやすくするため
 */
package com.mmwave.zone_configurator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "zone-configurator.transport")
public record TransportProperties(
    Boolean preferWebSocket,
    boolean forceRest,
    Duration wsConnectionTimeout,
    Duration handshakeTimeout,
    Duration requestTimeout,
    Duration reconnectDelay,
    Duration restPollingInterval,
    Integer maxMessageBytes,
    Integer deliveryThreads,
    Integer timerThreads) {

  public TransportProperties {
    preferWebSocket = preferWebSocket == null ? Boolean.TRUE : preferWebSocket;
    wsConnectionTimeout = positiveOrDefault(wsConnectionTimeout, Duration.ofMillis(5000));
    handshakeTimeout = positiveOrDefault(handshakeTimeout, Duration.ofSeconds(10));
    requestTimeout = positiveOrDefault(requestTimeout, Duration.ofSeconds(10));
    reconnectDelay = positiveOrDefault(reconnectDelay, Duration.ofSeconds(5));
    restPollingInterval = positiveOrDefault(restPollingInterval, Duration.ofMillis(1000));
    maxMessageBytes = maxMessageBytes == null || maxMessageBytes <= 0 ? 16 * 1024 * 1024 : maxMessageBytes;
    deliveryThreads = deliveryThreads == null || deliveryThreads <= 0 ? 4 : deliveryThreads;
    timerThreads = timerThreads == null || timerThreads <= 0 ? 2 : timerThreads;
  }

  public static TransportProperties defaults() {
    return new TransportProperties(null, false, null, null, null, null, null, null, null, null);
  }

  private static Duration positiveOrDefault(Duration value, Duration fallback) {
    return value == null || value.isZero() || value.isNegative() ? fallback : value;
  }
}
