package com.mmwave.zone_configurator.api.response;

public record MetaHealthResponse(String status, String mode, String readTransport, String timestamp) {}
