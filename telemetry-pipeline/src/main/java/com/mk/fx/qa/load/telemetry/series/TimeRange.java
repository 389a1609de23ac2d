package com.mk.fx.qa.load.telemetry.series;

import java.time.Duration;
import java.util.Arrays;

/** Trailing window of a series to keep, measured back from its latest point. */
public enum TimeRange {
  ALL("all", null),
  LAST_MINUTE("1m", Duration.ofMinutes(1)),
  LAST_FIVE_MINUTES("5m", Duration.ofMinutes(5));

  private final String alias;
  private final Duration limit;

  TimeRange(String alias, Duration limit) {
    this.alias = alias;
    this.limit = limit;
  }

  public String alias() {
    return alias;
  }

  public Duration limit() {
    return limit;
  }

  public static TimeRange fromValue(String value) {
    return Arrays.stream(values())
        .filter(
            range -> range.name().equalsIgnoreCase(value) || range.alias.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported time range: " + value));
  }
}
