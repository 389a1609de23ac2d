package com.mk.fx.qa.load.telemetry.pipeline;

import com.mk.fx.qa.load.telemetry.model.AggregateMetrics;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import java.util.List;
import java.util.Optional;

/**
 * Canonical records accepted from one raw event, together with what was dropped and which stages
 * failed. A result with errors may still carry the records produced before the failure.
 */
public record PipelineResult(
    List<MeasurementPoint> points,
    AggregateMetrics metrics,
    List<Rejection> rejections,
    List<PipelineError> errors) {

  public PipelineResult {
    points = List.copyOf(points);
    rejections = List.copyOf(rejections);
    errors = List.copyOf(errors);
  }

  static PipelineResult failed(PipelineError error) {
    return new PipelineResult(List.of(), null, List.of(), List.of(error));
  }

  public Optional<AggregateMetrics> latestMetrics() {
    return Optional.ofNullable(metrics);
  }

  public boolean isPartial() {
    return !errors.isEmpty();
  }
}
