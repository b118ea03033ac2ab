package com.mmwave.zone_configurator.api;

import com.mmwave.zone_configurator.transport.HomeAssistantTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(HomeAssistantTransportException.class)
  public ResponseEntity<ApiErrorResponse> handleTransport(HomeAssistantTransportException ex) {
    final HttpStatus status =
        switch (ex.reason()) {
          case TIMEOUT, REQUEST_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          default -> HttpStatus.BAD_GATEWAY;
        };
    logger.warn("home assistant call failed reason={} status={}", ex.reason(), status.value());
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse("HA_" + ex.reason().name(), ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(DeviceMappingNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleMappingNotFound(DeviceMappingNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("MAPPING_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("INTERNAL_ERROR", ex.getMessage()));
  }
}
