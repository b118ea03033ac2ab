package com.mmwave.zone_configurator.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.MoreExecutors;
import com.mmwave.zone_configurator.config.TransportProperties;
import com.mmwave.zone_configurator.model.TransportKind;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class TransportSelectorTest {

  private final StateTransportFactory factory = mock(StateTransportFactory.class);
  private final WebSocketStateTransport webSocket = mock(WebSocketStateTransport.class);
  private final RestStateTransport rest = mock(RestStateTransport.class);

  @Test
  void selectsWebSocketWhenItAuthenticatesInTime() {
    when(factory.createWebSocketTransport()).thenReturn(webSocket);
    when(factory.createRestTransport()).thenReturn(rest);
    when(webSocket.connect()).thenReturn(CompletableFuture.completedFuture(null));
    when(rest.ping()).thenReturn(true);

    final TransportSelection selection = selector(properties(false)).select();

    assertThat(selection.transport()).isSameAs(webSocket);
    assertThat(selection.status().readTransport()).isEqualTo(TransportKind.WEBSOCKET);
    assertThat(selection.status().webSocketAvailable()).isTrue();
    assertThat(selection.status().restAvailable()).isTrue();
    assertThat(selection.status().writeTransport()).isEqualTo(TransportKind.REST);
    verify(rest, never()).connect();
  }

  @Test
  void webSocketSelectionReportsRestUnavailableWhenProbeFails() {
    when(factory.createWebSocketTransport()).thenReturn(webSocket);
    when(factory.createRestTransport()).thenReturn(rest);
    when(webSocket.connect()).thenReturn(CompletableFuture.completedFuture(null));
    when(rest.ping()).thenReturn(false);

    final TransportSelection selection = selector(properties(false)).select();

    assertThat(selection.status().readTransport()).isEqualTo(TransportKind.WEBSOCKET);
    assertThat(selection.status().restAvailable()).isFalse();
  }

  @Test
  void fallsBackToRestWhenWebSocketTimesOut() {
    when(factory.createWebSocketTransport()).thenReturn(webSocket);
    when(factory.createRestTransport()).thenReturn(rest);
    when(webSocket.connect()).thenReturn(new CompletableFuture<>());
    when(rest.connect()).thenReturn(CompletableFuture.completedFuture(null));

    final TransportSelection selection = selector(properties(false)).select();

    assertThat(selection.transport()).isSameAs(rest);
    assertThat(selection.status().readTransport()).isEqualTo(TransportKind.REST);
    assertThat(selection.status().webSocketAvailable()).isFalse();
    assertThat(selection.status().restAvailable()).isTrue();
    verify(webSocket).disconnect();
  }

  @Test
  void fallsBackToRestWhenWebSocketAuthIsRejected() {
    when(factory.createWebSocketTransport()).thenReturn(webSocket);
    when(factory.createRestTransport()).thenReturn(rest);
    when(webSocket.connect())
        .thenReturn(
            CompletableFuture.failedFuture(
                new HomeAssistantTransportException(
                    HomeAssistantTransportException.Reason.AUTH, "Invalid access token")));
    when(rest.connect()).thenReturn(CompletableFuture.completedFuture(null));

    final TransportSelection selection = selector(properties(false)).select();

    assertThat(selection.transport()).isSameAs(rest);
    verify(webSocket).disconnect();
  }

  @Test
  void forceRestSkipsWebSocketEntirely() {
    when(factory.createRestTransport()).thenReturn(rest);
    when(rest.connect()).thenReturn(CompletableFuture.completedFuture(null));

    final TransportSelection selection = selector(properties(true)).select();

    assertThat(selection.transport()).isSameAs(rest);
    verify(factory, never()).createWebSocketTransport();
  }

  @Test
  void failsWhenNeitherTransportConnects() {
    when(factory.createWebSocketTransport()).thenReturn(webSocket);
    when(factory.createRestTransport()).thenReturn(rest);
    when(webSocket.connect()).thenReturn(new CompletableFuture<>());
    when(rest.connect())
        .thenReturn(
            CompletableFuture.failedFuture(
                new HomeAssistantTransportException(
                    HomeAssistantTransportException.Reason.CONNECTION, "refused")));

    assertThatThrownBy(() -> selector(properties(false)).select())
        .isInstanceOfSatisfying(
            HomeAssistantTransportException.class,
            ex -> {
              assertThat(ex.reason()).isEqualTo(HomeAssistantTransportException.Reason.CONNECTION);
              assertThat(ex).hasMessage("Failed to connect to Home Assistant via WebSocket or REST");
            });
  }

  private TransportSelector selector(TransportProperties properties) {
    return new TransportSelector(factory, properties, MoreExecutors.directExecutor());
  }

  private static TransportProperties properties(boolean forceRest) {
    return new TransportProperties(
        true, forceRest, Duration.ofMillis(50), null, null, null, null, null, null, null);
  }
}
