package com.mk.fx.qa.load.telemetry.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-field domains and the maximum accepted timestamp age. Shared by the normalizer (clamping)
 * and the validator (re-checking).
 */
public record ValidationRules(
    FieldRange responseTime,
    FieldRange throughput,
    FieldRange activeUsers,
    FieldRange errorRate,
    FieldRange statusCode,
    Duration maxAge) {

  public static final Duration DEFAULT_MAX_AGE = Duration.ofMinutes(5);

  public ValidationRules {
    Objects.requireNonNull(responseTime, "responseTime");
    Objects.requireNonNull(throughput, "throughput");
    Objects.requireNonNull(activeUsers, "activeUsers");
    Objects.requireNonNull(errorRate, "errorRate");
    Objects.requireNonNull(statusCode, "statusCode");
    Objects.requireNonNull(maxAge, "maxAge");
    if (maxAge.isNegative() || maxAge.isZero()) {
      throw new IllegalArgumentException("maxAge must be positive");
    }
  }

  public static ValidationRules defaults() {
    return new ValidationRules(
        FieldRange.of(0, 60_000),
        FieldRange.of(0, 1_000_000),
        FieldRange.of(0, 1_000_000),
        FieldRange.of(0, 100),
        FieldRange.of(100, 599),
        DEFAULT_MAX_AGE);
  }
}
