package com.mk.fx.qa.load.telemetry.pipeline;

import com.mk.fx.qa.load.telemetry.model.CleaningOptions;
import com.mk.fx.qa.load.telemetry.model.DownsampleConfig;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import com.mk.fx.qa.load.telemetry.series.SamplingInterval;
import com.mk.fx.qa.load.telemetry.series.TimeRange;
import java.util.List;

/**
 * Batch of accepted points to turn into a chart-ready series. Null options fall back to the
 * pipeline defaults; null windowing options mean no windowing.
 */
public record SeriesRequest(
    List<MeasurementPoint> points,
    CleaningOptions cleaning,
    TimeRange timeRange,
    SamplingInterval interval,
    DownsampleConfig downsample) {

  public SeriesRequest {
    points = points == null ? List.of() : points;
  }

  public static SeriesRequest of(List<MeasurementPoint> points) {
    return new SeriesRequest(points, null, null, null, null);
  }

  public static SeriesRequest of(List<MeasurementPoint> points, DownsampleConfig downsample) {
    return new SeriesRequest(points, null, null, null, downsample);
  }
}
