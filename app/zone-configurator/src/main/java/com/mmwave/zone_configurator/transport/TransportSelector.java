/*
 * どこで: Zone Configurator 起動時
 * 何を: WebSocket を優先し、時間内に認証できなければ REST へ切り替える
 * なぜ: HA の構成差 (Supervisor/スタンドアロン) に関わらず読み取り経路を確保するため
 */
package com.mmwave.zone_configurator.transport;

import com.mmwave.zone_configurator.config.TransportProperties;
import com.mmwave.zone_configurator.model.TransportKind;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TransportSelector {

  private static final Logger logger = LoggerFactory.getLogger(TransportSelector.class);

  private final StateTransportFactory factory;
  private final TransportProperties properties;
  private final Executor probeExecutor;

  public TransportSelector(
      StateTransportFactory factory, TransportProperties properties, Executor probeExecutor) {
    this.factory = factory;
    this.properties = properties;
    this.probeExecutor = probeExecutor;
  }

  public TransportSelection select() {
    if (properties.forceRest()) {
      logger.info("rest transport forced, skipping websocket");
    } else if (properties.preferWebSocket()) {
      final TransportSelection streaming = tryWebSocket();
      if (streaming != null) {
        return streaming;
      }
    }
    final RestStateTransport rest = factory.createRestTransport();
    try {
      rest.connect().join();
    } catch (CompletionException ex) {
      logger.error("home assistant rest connection failed", ex.getCause());
      throw new HomeAssistantTransportException(
          HomeAssistantTransportException.Reason.CONNECTION,
          "Failed to connect to Home Assistant via WebSocket or REST",
          ex.getCause());
    }
    logger.info(
        "read transport selected transport=rest pollingInterval={}",
        properties.restPollingInterval());
    return new TransportSelection(rest, new TransportStatus(TransportKind.REST, false, true));
  }

  private TransportSelection tryWebSocket() {
    final WebSocketStateTransport webSocket = factory.createWebSocketTransport();
    try {
      webSocket
          .connect()
          .get(properties.wsConnectionTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      logger.warn(
          "websocket connection timed out after {}, falling back to rest",
          properties.wsConnectionTimeout());
      webSocket.disconnect();
      return null;
    } catch (ExecutionException ex) {
      logger.warn(
          "websocket connection failed reason={}, falling back to rest",
          ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage());
      webSocket.disconnect();
      return null;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      webSocket.disconnect();
      throw new HomeAssistantTransportException(
          HomeAssistantTransportException.Reason.CONNECTION,
          "interrupted while connecting to Home Assistant",
          ex);
    }
    final TransportStatus status = new TransportStatus(TransportKind.WEBSOCKET, true, false);
    probeRest(status);
    logger.info("read transport selected transport=websocket");
    return new TransportSelection(webSocket, status);
  }

  private void probeRest(TransportStatus status) {
    CompletableFuture.supplyAsync(() -> factory.createRestTransport().ping(), probeExecutor)
        .whenComplete(
            (available, ex) -> {
              if (ex != null) {
                logger.warn("rest availability probe failed", ex);
                return;
              }
              status.markRestAvailable(available);
              logger.info("rest availability probed available={}", available);
            });
  }
}
