/*
 * どこで: Zone Configurator 設定
 * 何を: live 配信 WebSocket エンドポイントを登録する
 * なぜ: UI がリアルタイムにターゲット/センサー値を受け取るため
 */
package com.mmwave.zone_configurator.config;

import com.mmwave.zone_configurator.live.LiveWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class LiveWebSocketConfig implements WebSocketConfigurer {

  private final LiveWebSocketHandler liveWebSocketHandler;
  private final LiveProperties liveProperties;

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(liveWebSocketHandler, liveProperties.path())
        .setAllowedOriginPatterns(liveProperties.allowedOriginPatterns().toArray(String[]::new));
  }
}
