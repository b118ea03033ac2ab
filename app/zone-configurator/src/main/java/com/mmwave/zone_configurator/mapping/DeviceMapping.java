package com.mmwave.zone_configurator.mapping;

import java.time.Instant;
import java.util.Map;

public record DeviceMapping(
    String deviceId,
    String profileId,
    Map<String, String> entities,
    Map<String, Map<String, String>> trackingTargets,
    Instant updatedAt) {

  public DeviceMapping {
    entities = entities == null ? Map.of() : Map.copyOf(entities);
    trackingTargets =
        trackingTargets == null ? Map.of() : Map.copyOf(trackingTargets);
  }
}
