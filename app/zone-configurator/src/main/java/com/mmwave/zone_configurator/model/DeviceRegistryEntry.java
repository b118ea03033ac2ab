package com.mmwave.zone_configurator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeviceRegistryEntry(
    String id,
    String name,
    String nameByUser,
    String manufacturer,
    String model,
    String swVersion,
    String hwVersion,
    String areaId,
    JsonNode identifiers) {}
