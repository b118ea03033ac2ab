/*
 * どこで: Zone Configurator サービス層
 * 何を: transport 再接続/タイムアウト/配信エラーと live 配信のメトリクスを記録する
 * なぜ: HA との接続品質と live セッション数を Prometheus から直接観測できるようにするため
 */
package com.mmwave.zone_configurator.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ZoneConfiguratorMetrics {

  private static final String METRIC_RECONNECT_TOTAL = "zc.transport.reconnect.total";
  private static final String METRIC_REQUEST_TIMEOUT_TOTAL = "zc.transport.request.timeout.total";
  private static final String METRIC_SUBSCRIBER_ERROR_TOTAL =
      "zc.transport.subscriber.error.total";
  private static final String METRIC_POLL_FAILURE_TOTAL = "zc.transport.poll.failure.total";
  private static final String METRIC_LIVE_MESSAGE_TOTAL = "zc.live.message.total";
  private static final String METRIC_LIVE_SESSIONS = "zc.live.sessions";

  private final MeterRegistry meterRegistry;
  private final Counter reconnectCounter;
  private final Counter requestTimeoutCounter;
  private final Counter pollFailureCounter;
  private final ConcurrentMap<String, Counter> subscriberErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> liveMessageCounters = new ConcurrentHashMap<>();

  public ZoneConfiguratorMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.reconnectCounter =
        Counter.builder(METRIC_RECONNECT_TOTAL)
            .description("Streaming transport reconnect attempts")
            .register(meterRegistry);
    this.requestTimeoutCounter =
        Counter.builder(METRIC_REQUEST_TIMEOUT_TOTAL)
            .description("Streaming transport requests that timed out")
            .register(meterRegistry);
    this.pollFailureCounter =
        Counter.builder(METRIC_POLL_FAILURE_TOTAL)
            .description("Polling transport ticks that failed")
            .register(meterRegistry);
  }

  public void recordReconnectAttempt() {
    reconnectCounter.increment();
  }

  public void recordRequestTimeout() {
    requestTimeoutCounter.increment();
  }

  public void recordPollFailure() {
    pollFailureCounter.increment();
  }

  public void recordSubscriberError(String transport) {
    subscriberErrorCounters
        .computeIfAbsent(
            transport,
            ignored ->
                Counter.builder(METRIC_SUBSCRIBER_ERROR_TOTAL)
                    .description("State change listeners that threw")
                    .tags(Tags.of("transport", transport))
                    .register(meterRegistry))
        .increment();
  }

  public void recordLiveMessage(String type) {
    liveMessageCounters
        .computeIfAbsent(
            type,
            ignored ->
                Counter.builder(METRIC_LIVE_MESSAGE_TOTAL)
                    .description("Messages sent to live clients by type")
                    .tags(Tags.of("type", type))
                    .register(meterRegistry))
        .increment();
  }

  public void bindLiveSessions(Map<?, ?> sessions) {
    Gauge.builder(METRIC_LIVE_SESSIONS, sessions, Map::size)
        .description("Connected live clients")
        .register(meterRegistry);
  }
}
