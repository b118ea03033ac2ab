package com.mmwave.zone_configurator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/api/services/number/set_value");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    request.addParameter("deviceId", "dev-1");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    try {
      interceptor.preHandle(request, response, new Object());
    } catch (Exception ex) {
      fail("preHandle should not throw", ex);
    }

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/api/services/number/set_value");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(MDC.get("device_id")).isEqualTo("dev-1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("device_id")).isNull();
  }

  @Test
  void pathVariablesFillDeviceAndServiceKeys() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/api/services/number/set_value");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE,
        Map.of("domain", "number", "service", "set_value"));
    request.setRemoteAddr("192.168.1.20");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("ha_service")).isEqualTo("number.set_value");
    assertThat(MDC.get("client_ip")).isEqualTo("192.168.1.20");
    assertThat(MDC.get("device_id")).isNull();

    interceptor.afterCompletion(request, new MockHttpServletResponse(), new Object(), null);
    assertThat(MDC.get("ha_service")).isNull();
  }

  @Test
  void deviceIdPathVariableWinsOverQueryParameter() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("PUT", "/api/device-mappings/dev-path");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("deviceId", "dev-path"));
    request.addParameter("deviceId", "dev-query");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("device_id")).isEqualTo("dev-path");
  }

  @Test
  void generatesRequestIdWhenHeaderMissing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/health");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("device_id")).isNull();
  }
}
