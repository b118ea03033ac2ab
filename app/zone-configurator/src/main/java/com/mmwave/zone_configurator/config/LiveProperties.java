/*
 * どこで: Zone Configurator 設定
 * 何を: live 配信 WebSocket エンドポイントの設定を保持する
 * なぜ: パス/許可オリジン/送信バッファ上限を外部化するため
 */
package com.mmwave.zone_configurator.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "zone-configurator.live")
public record LiveProperties(
    String path, List<String> allowedOriginPatterns, Duration sendTimeLimit, Integer sendBufferLimitBytes) {

  public LiveProperties {
    path = path == null || path.isBlank() ? "/api/live/ws" : path;
    allowedOriginPatterns =
        allowedOriginPatterns == null || allowedOriginPatterns.isEmpty()
            ? List.of("*")
            : List.copyOf(allowedOriginPatterns);
    sendTimeLimit =
        sendTimeLimit == null || sendTimeLimit.isNegative() || sendTimeLimit.isZero()
            ? Duration.ofSeconds(10)
            : sendTimeLimit;
    sendBufferLimitBytes =
        sendBufferLimitBytes == null || sendBufferLimitBytes <= 0 ? 512 * 1024 : sendBufferLimitBytes;
  }

  public static LiveProperties defaults() {
    return new LiveProperties(null, null, null, null);
  }
}
