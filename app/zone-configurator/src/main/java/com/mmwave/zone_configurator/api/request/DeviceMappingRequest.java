package com.mmwave.zone_configurator.api.request;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

public record DeviceMappingRequest(
    @NotBlank String profileId,
    Map<String, String> entities,
    Map<String, Map<String, String>> trackingTargets) {}
