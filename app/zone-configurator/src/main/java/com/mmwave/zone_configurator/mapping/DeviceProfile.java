package com.mmwave.zone_configurator.mapping;

import java.util.Map;

public record DeviceProfile(
    String id, String label, Map<String, String> entityTemplates, int trackingTargets) {

  public DeviceProfile {
    entityTemplates = entityTemplates == null ? Map.of() : Map.copyOf(entityTemplates);
  }
}
