package com.mk.fx.qa.load.telemetry.model;

import java.util.Arrays;

public enum DownsampleStrategy {
  UNIFORM,
  ADAPTIVE,
  IMPORTANCE;

  public static DownsampleStrategy fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported strategy: " + value));
  }
}
