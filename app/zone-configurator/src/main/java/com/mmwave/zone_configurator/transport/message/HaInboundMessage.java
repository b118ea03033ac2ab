package com.mmwave.zone_configurator.transport.message;

import com.fasterxml.jackson.databind.JsonNode;

public sealed interface HaInboundMessage
    permits HaInboundMessage.AuthRequired,
        HaInboundMessage.AuthOk,
        HaInboundMessage.AuthInvalid,
        HaInboundMessage.Result,
        HaInboundMessage.Event {

  record AuthRequired(String haVersion) implements HaInboundMessage {}

  record AuthOk(String haVersion) implements HaInboundMessage {}

  record AuthInvalid(String message) implements HaInboundMessage {}

  record Result(int id, boolean success, JsonNode result, JsonNode error)
      implements HaInboundMessage {}

  record Event(int id, String eventType, JsonNode data) implements HaInboundMessage {}
}
