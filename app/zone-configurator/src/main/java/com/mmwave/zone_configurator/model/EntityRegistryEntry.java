package com.mmwave.zone_configurator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EntityRegistryEntry(
    String entityId,
    String deviceId,
    String platform,
    String name,
    String originalName,
    String areaId,
    String disabledBy,
    String hiddenBy,
    String entityCategory,
    String uniqueId) {}
