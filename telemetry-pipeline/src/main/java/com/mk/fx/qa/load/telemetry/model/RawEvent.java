package com.mk.fx.qa.load.telemetry.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.Objects;

/** Raw payload as received from one of the producers, before any normalization. */
public record RawEvent(SourceType source, JsonNode payload) {

  public RawEvent {
    Objects.requireNonNull(source, "source");
    payload = payload == null ? MissingNode.getInstance() : payload;
  }
}
