package com.mmwave.zone_configurator.live.message;

import java.util.Map;

public record LiveEntityState(String state, Map<String, Object> attributes) {}
