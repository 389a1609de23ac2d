package com.mk.fx.qa.load.telemetry.model;

import java.util.List;

/**
 * Outcome of one downsampling call. Results may be served again from the cache, in which case
 * {@code cacheHit} is set. The list is immutable but {@link MeasurementPoint}s are not, so the
 * cache only ever holds and hands out {@link #detached()} copies.
 */
public record DownsampleResult(
    List<MeasurementPoint> points,
    int originalCount,
    int resultCount,
    double compressionRatio,
    long processingDurationMs,
    boolean cacheHit,
    DownsampleStrategy strategy,
    int compensatedPoints) {

  public DownsampleResult {
    points = List.copyOf(points);
  }

  public static DownsampleResult passThrough(
      List<MeasurementPoint> points, DownsampleStrategy strategy, long durationMs) {
    return new DownsampleResult(
        points, points.size(), points.size(), 1.0, durationMs, false, strategy, 0);
  }

  /** Same result over fresh copies of every point. */
  public DownsampleResult detached() {
    return new DownsampleResult(
        copyPoints(),
        originalCount,
        resultCount,
        compressionRatio,
        processingDurationMs,
        cacheHit,
        strategy,
        compensatedPoints);
  }

  public DownsampleResult asCacheHit(long durationMs) {
    return new DownsampleResult(
        copyPoints(),
        originalCount,
        resultCount,
        compressionRatio,
        durationMs,
        true,
        strategy,
        compensatedPoints);
  }

  private List<MeasurementPoint> copyPoints() {
    return points.stream().map(MeasurementPoint::copy).toList();
  }
}
