package com.mmwave.zone_configurator.live.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

@JsonInclude(JsonInclude.Include.ALWAYS)
public record StateUpdateMessage(
    String type, String entityId, String state, Map<String, Object> attributes, long timestamp) {

  public static StateUpdateMessage of(
      String entityId, String state, Map<String, Object> attributes, long timestamp) {
    return new StateUpdateMessage("state_update", entityId, state, attributes, timestamp);
  }
}
