/*
 * どこで: Zone Configurator API 入口
 * 何を: リクエスト ID・クライアント・対象デバイス・HA サービスを MDC へ積み、完了時に外す
 * なぜ: UI からの設定変更と HA 呼び出しのログを 1 リクエスト単位で追えるようにするため
 */
package com.mmwave.zone_configurator.config;

import com.mmwave.common.Ids;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> pathVariables = pathVariables(request);
    final List<String> keys = new ArrayList<>();
    put(keys, "request_id", resolveRequestId(request));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", resolveClientIp(request));
    put(keys, "device_id", resolveDeviceId(request, pathVariables));
    put(keys, "ha_service", resolveService(pathVariables));
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (!(request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys)) {
      return;
    }
    rawKeys.stream().filter(String.class::isInstance).map(String.class::cast).forEach(MDC::remove);
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(REQUEST_ID_HEADER);
    return Ids.isBlank(requestId) ? Ids.newRequestId() : requestId;
  }

  // 先頭がクライアント、以降はプロキシ
  private String resolveClientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (Ids.isBlank(forwarded)) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }

  private String resolveDeviceId(HttpServletRequest request, Map<String, String> pathVariables) {
    final String fromPath = pathVariables.get("deviceId");
    return Ids.isBlank(fromPath) ? request.getParameter("deviceId") : fromPath;
  }

  private String resolveService(Map<String, String> pathVariables) {
    final String domain = pathVariables.get("domain");
    final String service = pathVariables.get("service");
    if (Ids.isBlank(domain) || Ids.isBlank(service)) {
      return null;
    }
    return domain + "." + service;
  }

  @SuppressWarnings("unchecked")
  private Map<String, String> pathVariables(HttpServletRequest request) {
    final Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    return attribute instanceof Map<?, ?> variables ? (Map<String, String>) variables : Map.of();
  }

  private void put(List<String> keys, String key, String value) {
    if (Ids.isBlank(value)) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
