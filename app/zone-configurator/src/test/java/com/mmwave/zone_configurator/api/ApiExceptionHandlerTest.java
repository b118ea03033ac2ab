package com.mmwave.zone_configurator.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.mmwave.zone_configurator.transport.HomeAssistantTransportException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void handshakeTimeoutReturns504() {
    final var response =
        handler.handleTransport(
            new HomeAssistantTransportException(
                HomeAssistantTransportException.Reason.TIMEOUT, "Authentication timeout"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse("HA_TIMEOUT", "Authentication timeout"));
  }

  @Test
  void authFailureReturns502() {
    final var response =
        handler.handleTransport(
            new HomeAssistantTransportException(
                HomeAssistantTransportException.Reason.AUTH, "Invalid access token"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(response.getBody().code()).isEqualTo("HA_AUTH");
  }

  @Test
  void handleValidationReturns400() {
    final var response = handler.handleValidation((MethodArgumentNotValidException) null);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().code()).isEqualTo("VALIDATION_ERROR");
  }

  @Test
  void handleMappingNotFoundReturns404() {
    final var response =
        handler.handleMappingNotFound(new DeviceMappingNotFoundException("dev-1"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().message()).contains("dev-1");
  }

  @Test
  void handleRuntimeReturns500() {
    final var response = handler.handleRuntime(new RuntimeException("oops"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo("INTERNAL_ERROR");
  }
}
