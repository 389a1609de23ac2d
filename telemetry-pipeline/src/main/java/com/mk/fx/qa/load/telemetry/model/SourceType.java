package com.mk.fx.qa.load.telemetry.model;

import java.util.Arrays;

/** Producer shape a raw telemetry payload arrived in. */
public enum SourceType {
  PUSH_CHANNEL("push"),
  POLL_RESPONSE("poll"),
  WORKER_STATUS("worker");

  private final String alias;

  SourceType(String alias) {
    this.alias = alias;
  }

  public String alias() {
    return alias;
  }

  public static SourceType fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.alias.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported telemetry source: " + value));
  }
}
