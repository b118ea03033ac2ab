/*
 * どこで: Zone Configurator 設定
 * 何を: Home Assistant 接続情報 (supervisor / standalone) を保持する
 * なぜ: add-on 実行と単体実行で接続先とトークンの供給元が異なるため
 */
package com.mmwave.zone_configurator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "zone-configurator.home-assistant")
public record HomeAssistantProperties(
    String baseUrl, String longLivedToken, String supervisorToken, String supervisorApiUrl) {

  static final String DEFAULT_SUPERVISOR_BASE_URL = "http://supervisor/core/api";
  static final String DEFAULT_SUPERVISOR_API_URL = "http://supervisor";

  public HomeAssistantProperties {
    supervisorApiUrl =
        supervisorApiUrl == null || supervisorApiUrl.isBlank()
            ? DEFAULT_SUPERVISOR_API_URL
            : supervisorApiUrl;
  }

  public HomeAssistantConnection resolve() {
    if (!isBlank(supervisorToken)) {
      return new HomeAssistantConnection(
          HomeAssistantConnection.Mode.SUPERVISOR,
          HomeAssistantConnection.normalizeBaseUrl(
              isBlank(baseUrl) ? DEFAULT_SUPERVISOR_BASE_URL : baseUrl),
          supervisorToken,
          HomeAssistantConnection.trimTrailingSlash(supervisorApiUrl));
    }
    if (!isBlank(baseUrl) && !isBlank(longLivedToken)) {
      return new HomeAssistantConnection(
          HomeAssistantConnection.Mode.STANDALONE,
          HomeAssistantConnection.normalizeBaseUrl(baseUrl),
          longLivedToken,
          null);
    }
    throw new IllegalStateException(
        "Home Assistant credentials are not configured. Provide SUPERVISOR_TOKEN (add-on) or"
            + " HA_BASE_URL and HA_LONG_LIVED_TOKEN (standalone).");
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
