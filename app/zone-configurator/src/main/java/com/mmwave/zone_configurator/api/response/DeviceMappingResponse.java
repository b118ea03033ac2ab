package com.mmwave.zone_configurator.api.response;

import java.util.Map;

public record DeviceMappingResponse(
    String deviceId,
    String profileId,
    Map<String, String> entities,
    Map<String, Map<String, String>> trackingTargets,
    String updatedAt) {}
