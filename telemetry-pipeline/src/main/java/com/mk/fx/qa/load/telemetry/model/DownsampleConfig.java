package com.mk.fx.qa.load.telemetry.model;

import java.util.Objects;

/** Target cardinality and strategy for reducing a series. */
public record DownsampleConfig(
    int maxPoints, DownsampleStrategy strategy, boolean preserveKeyPoints, boolean cacheEnabled) {

  public static final int DEFAULT_MAX_POINTS = 1000;

  public DownsampleConfig {
    Objects.requireNonNull(strategy, "strategy");
    if (maxPoints < 2) {
      throw new IllegalArgumentException("maxPoints must be >= 2");
    }
  }

  public static DownsampleConfig defaults() {
    return new DownsampleConfig(DEFAULT_MAX_POINTS, DownsampleStrategy.ADAPTIVE, true, true);
  }

  public DownsampleConfig withMaxPoints(int maxPoints) {
    return new DownsampleConfig(maxPoints, strategy, preserveKeyPoints, cacheEnabled);
  }

  public DownsampleConfig withStrategy(DownsampleStrategy strategy) {
    return new DownsampleConfig(maxPoints, strategy, preserveKeyPoints, cacheEnabled);
  }
}
