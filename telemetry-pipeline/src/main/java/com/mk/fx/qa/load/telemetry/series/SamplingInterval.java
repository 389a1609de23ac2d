package com.mk.fx.qa.load.telemetry.series;

import java.time.Duration;
import java.util.Arrays;

/** Bucket width used when aggregating a series into fixed intervals. */
public enum SamplingInterval {
  ONE_SECOND("1s", Duration.ofSeconds(1)),
  FIVE_SECONDS("5s", Duration.ofSeconds(5)),
  TEN_SECONDS("10s", Duration.ofSeconds(10));

  private final String alias;
  private final Duration width;

  SamplingInterval(String alias, Duration width) {
    this.alias = alias;
    this.width = width;
  }

  public String alias() {
    return alias;
  }

  public Duration width() {
    return width;
  }

  public static SamplingInterval fromValue(String value) {
    return Arrays.stream(values())
        .filter(
            interval ->
                interval.name().equalsIgnoreCase(value) || interval.alias.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported interval: " + value));
  }
}
