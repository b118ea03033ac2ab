package com.mmwave.zone_configurator.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.mmwave.zone_configurator.service.HomeAssistantServiceClient;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class ServiceCallController {

  private final HomeAssistantServiceClient serviceClient;

  @PostMapping("/api/services/{domain}/{service}")
  public ResponseEntity<JsonNode> callService(
      @PathVariable("domain") String domain,
      @PathVariable("service") String service,
      @RequestParam(name = "returnResponse", defaultValue = "false") boolean returnResponse,
      @RequestBody(required = false) Map<String, Object> data) {
    return serviceClient
        .callService(domain, service, data, returnResponse)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }
}
