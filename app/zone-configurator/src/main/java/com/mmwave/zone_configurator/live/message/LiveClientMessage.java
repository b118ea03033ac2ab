package com.mmwave.zone_configurator.live.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

// entityMappings はオブジェクトでも JSON 文字列でも届く
@JsonIgnoreProperties(ignoreUnknown = true)
public record LiveClientMessage(
    String type,
    String deviceId,
    String profileId,
    String entityNamePrefix,
    JsonNode entityMappings) {}
