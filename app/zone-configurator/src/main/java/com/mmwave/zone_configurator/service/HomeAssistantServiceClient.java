package com.mmwave.zone_configurator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mmwave.zone_configurator.transport.HomeAssistantTransportException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class HomeAssistantServiceClient {

  private static final Logger logger = LoggerFactory.getLogger(HomeAssistantServiceClient.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient homeAssistantRestClient;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public HomeAssistantServiceClient(RestClient homeAssistantRestClient, ObjectMapper objectMapper) {
    this.homeAssistantRestClient = homeAssistantRestClient;
    this.objectMapper = objectMapper;
  }

  /**
   * 役割: HA の domain.service を REST で呼び出す。
   * 動作: returnResponse 指定時は応答本文を JSON として返し、本文が無ければ empty を返す。
   * 前提: domain と service は空でないこと。
   */
  public Optional<JsonNode> callService(
      String domain, String service, Map<String, Object> data, boolean returnResponse) {
    requireText(domain, "domain");
    requireText(service, "service");
    final String path =
        returnResponse
            ? "/services/{domain}/{service}?return_response=true"
            : "/services/{domain}/{service}";
    logger.info("home assistant service call domain={} service={}", domain, service);
    final String body;
    try {
      body =
          homeAssistantRestClient
              .post()
              .uri(path, domain, service)
              .contentType(MediaType.APPLICATION_JSON)
              .body(data == null ? Map.of() : data)
              .retrieve()
              .body(String.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, domain + "." + service);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, domain + "." + service);
    }
    return parse(body, domain + "." + service);
  }

  public void setNumber(String entityId, double value) {
    callService("number", "set_value", target(entityId, "value", value), false);
  }

  public void selectOption(String entityId, String option) {
    callService("select", "select_option", target(entityId, "option", option), false);
  }

  public void setSwitch(String entityId, boolean on) {
    callService("switch", on ? "turn_on" : "turn_off", target(entityId, null, null), false);
  }

  public void setInputBoolean(String entityId, boolean on) {
    callService("input_boolean", on ? "turn_on" : "turn_off", target(entityId, null, null), false);
  }

  public void setText(String entityId, String value) {
    callService("text", "set_value", target(entityId, "value", value), false);
  }

  public Optional<JsonNode> updateEntityRegistry(String entityId, Map<String, Object> updates) {
    requireText(entityId, "entityId");
    logger.info("home assistant entity registry update entityId={} fields={}", entityId, updates.keySet());
    final String body;
    try {
      body =
          homeAssistantRestClient
              .post()
              .uri("/config/entity_registry/{entityId}", entityId)
              .contentType(MediaType.APPLICATION_JSON)
              .body(updates)
              .retrieve()
              .body(String.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "entity_registry");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "entity_registry");
    }
    return parse(body, "entity_registry");
  }

  private Map<String, Object> target(String entityId, String field, Object value) {
    requireText(entityId, "entityId");
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("entity_id", entityId);
    if (field != null) {
      data.put(field, value);
    }
    return data;
  }

  private Optional<JsonNode> parse(String body, String operation) {
    if (body == null || body.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readTree(body));
    } catch (JsonProcessingException ex) {
      logger.warn("home assistant {} returned a non-json body", operation, ex);
      throw new HomeAssistantTransportException(
          HomeAssistantTransportException.Reason.INVALID_RESPONSE,
          "home assistant response parse failed",
          ex);
    }
  }

  private HomeAssistantTransportException mapResponseException(
      RestClientResponseException ex, String operation) {
    logger.warn(
        "home assistant {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().value() == 401 || ex.getStatusCode().value() == 403) {
      return new HomeAssistantTransportException(
          HomeAssistantTransportException.Reason.AUTH, "home assistant rejected credentials", ex);
    }
    return new HomeAssistantTransportException(
        HomeAssistantTransportException.Reason.REJECTED,
        "Service call failed: " + ex.getStatusCode().value() + " " + ex.getResponseBodyAsString(),
        ex);
  }

  private HomeAssistantTransportException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("home assistant {} timed out", operation);
      return new HomeAssistantTransportException(
          HomeAssistantTransportException.Reason.REQUEST_TIMEOUT,
          "home assistant request timeout",
          ex);
    }
    logger.warn("home assistant {} connection failed", operation, ex);
    return new HomeAssistantTransportException(
        HomeAssistantTransportException.Reason.CONNECTION, "home assistant connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
