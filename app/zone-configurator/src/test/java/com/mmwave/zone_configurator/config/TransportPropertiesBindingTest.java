/*
 * どこで: Zone Configurator 設定バインドテスト
 * 何を: transport/live/device プロファイル設定のバインドと既定値を検証する
 * なぜ: 環境変数経由の上書きが起動時に正しく解釈されることを保証するため
 */
package com.mmwave.zone_configurator.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class TransportPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsOverridesAsDurations() {
    contextRunner
        .withPropertyValues(
            "zone-configurator.transport.force-rest=true",
            "zone-configurator.transport.ws-connection-timeout=2s",
            "zone-configurator.transport.rest-polling-interval=500ms",
            "zone-configurator.live.path=/live",
            "zone-configurator.device.profiles.ep1.label=EP1",
            "zone-configurator.device.profiles.ep1.entities[presenceEntity]=binary_sensor.{name}_occupancy",
            "zone-configurator.device.profiles.ep1.tracking-targets=0")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final TransportProperties transport = context.getBean(TransportProperties.class);
              final LiveProperties live = context.getBean(LiveProperties.class);
              final DeviceProfileProperties device = context.getBean(DeviceProfileProperties.class);

              assertThat(transport.forceRest()).isTrue();
              assertThat(transport.wsConnectionTimeout()).isEqualTo(Duration.ofSeconds(2));
              assertThat(transport.restPollingInterval()).isEqualTo(Duration.ofMillis(500));
              assertThat(transport.requestTimeout()).isEqualTo(Duration.ofSeconds(10));
              assertThat(live.path()).isEqualTo("/live");
              assertThat(device.profiles().get("ep1").entities())
                  .containsEntry("presenceEntity", "binary_sensor.{name}_occupancy");
            });
  }

  @Test
  void appliesDefaultsWhenUnset() {
    contextRunner.run(
        context -> {
          final TransportProperties transport = context.getBean(TransportProperties.class);

          assertThat(transport.preferWebSocket()).isTrue();
          assertThat(transport.forceRest()).isFalse();
          assertThat(transport.wsConnectionTimeout()).isEqualTo(Duration.ofSeconds(5));
          assertThat(transport.handshakeTimeout()).isEqualTo(Duration.ofSeconds(10));
          assertThat(transport.reconnectDelay()).isEqualTo(Duration.ofSeconds(5));
          assertThat(transport.restPollingInterval()).isEqualTo(Duration.ofSeconds(1));
          assertThat(transport.maxMessageBytes()).isEqualTo(16 * 1024 * 1024);
          assertThat(context.getBean(LiveProperties.class).path()).isEqualTo("/api/live/ws");
        });
  }

  @Configuration
  @EnableConfigurationProperties({
    TransportProperties.class,
    LiveProperties.class,
    DeviceProfileProperties.class
  })
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
