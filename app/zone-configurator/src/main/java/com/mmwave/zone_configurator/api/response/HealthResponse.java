package com.mmwave.zone_configurator.api.response;

public record HealthResponse(String status) {}
