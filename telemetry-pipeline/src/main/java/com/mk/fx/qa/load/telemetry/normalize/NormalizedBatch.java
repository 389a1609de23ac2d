package com.mk.fx.qa.load.telemetry.normalize;

import com.mk.fx.qa.load.telemetry.model.AggregateMetrics;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import java.util.List;
import java.util.Optional;

/** Canonical records extracted from one raw payload; either part may be empty. */
public record NormalizedBatch(List<MeasurementPoint> points, AggregateMetrics metrics) {

  public NormalizedBatch {
    points = List.copyOf(points);
  }

  public static NormalizedBatch empty() {
    return new NormalizedBatch(List.of(), null);
  }

  public Optional<AggregateMetrics> metricsOptional() {
    return Optional.ofNullable(metrics);
  }

  public boolean isEmpty() {
    return points.isEmpty() && metrics == null;
  }
}
