package com.mmwave.zone_configurator.transport;

public record TransportSelection(StateTransport transport, TransportStatus status) {}
