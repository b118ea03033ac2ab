/*
 * どこで: Zone Configurator HA 接続情報
 * 何を: ベース URL を /api 終端へ正規化し、WebSocket URI とトークンを伏せた表示を提供する
 * なぜ: トークンをログや API 応答へ出さないため
 */
package com.mmwave.zone_configurator.config;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

public record HomeAssistantConnection(
    Mode mode, String baseUrl, String token, String supervisorApiUrl) {

  static final String REDACTED = "***redacted***";

  public enum Mode {
    SUPERVISOR("supervisor"),
    STANDALONE("standalone");

    private final String value;

    Mode(String value) {
      this.value = value;
    }

    public String value() {
      return value;
    }
  }

  public URI webSocketUri() {
    final String root = baseUrl.replaceAll("/api/?$", "");
    return URI.create(root.replaceFirst("^http", "ws") + "/api/websocket");
  }

  public Map<String, Object> redacted() {
    final Map<String, Object> view = new LinkedHashMap<>();
    view.put("mode", mode.value());
    view.put("baseUrl", baseUrl);
    view.put("token", REDACTED);
    if (supervisorApiUrl != null) {
      view.put("supervisorApiUrl", supervisorApiUrl);
    }
    return view;
  }

  @Override
  public String toString() {
    return "HomeAssistantConnection[mode="
        + mode.value()
        + ", baseUrl="
        + baseUrl
        + ", token="
        + REDACTED
        + "]";
  }

  static String trimTrailingSlash(String value) {
    return value.replaceAll("/+$", "");
  }

  static String normalizeBaseUrl(String url) {
    final String trimmed = trimTrailingSlash(url.trim());
    return trimmed.endsWith("/api") ? trimmed : trimmed + "/api";
  }
}
