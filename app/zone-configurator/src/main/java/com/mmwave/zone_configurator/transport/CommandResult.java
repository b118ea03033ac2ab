package com.mmwave.zone_configurator.transport;

import com.fasterxml.jackson.databind.JsonNode;

public record CommandResult(int id, boolean success, JsonNode result, JsonNode error) {

  public String errorMessage() {
    if (error == null || error.isNull()) {
      return null;
    }
    return error.path("message").asText(error.toString());
  }
}
