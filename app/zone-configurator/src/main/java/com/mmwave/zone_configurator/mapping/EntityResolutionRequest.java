package com.mmwave.zone_configurator.mapping;

import com.fasterxml.jackson.databind.JsonNode;

public record EntityResolutionRequest(
    String deviceId, String profileId, String entityNamePrefix, JsonNode legacyMappings) {}
