package com.mk.fx.qa.load.telemetry.series;

import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Trims and buckets a series before it is downsampled for display.
 *
 * <p>Both operations work relative to the series' own timestamps rather than the wall clock, so
 * historical runs are windowed the same way as live ones.
 */
@Slf4j
public class SeriesWindowing {

  /**
   * Keeps the points within {@code range} of the latest timestamp. Series whose whole span fits in
   * the range are returned as they are.
   */
  public List<MeasurementPoint> filterByTimeRange(List<MeasurementPoint> points, TimeRange range) {
    Objects.requireNonNull(range, "range");
    if (points == null || points.isEmpty()) {
      return List.of();
    }
    if (range == TimeRange.ALL) {
      return points;
    }

    long earliest = Long.MAX_VALUE;
    long latest = Long.MIN_VALUE;
    for (MeasurementPoint p : points) {
      earliest = Math.min(earliest, p.getTimestamp());
      latest = Math.max(latest, p.getTimestamp());
    }
    long limitMs = range.limit().toMillis();
    if (latest - earliest <= limitMs) {
      return points;
    }

    long cutoff = latest - limitMs;
    List<MeasurementPoint> filtered = new ArrayList<>();
    for (MeasurementPoint p : points) {
      if (p.getTimestamp() >= cutoff) {
        filtered.add(p);
      }
    }
    log.debug("Time range {} filter: {} -> {} points", range, points.size(), filtered.size());
    return filtered;
  }

  /**
   * Averages the series into fixed buckets starting at its earliest timestamp. Each non-empty
   * bucket yields one point stamped at the bucket mid-point; status, success flag and phase are
   * taken from the bucket's first point.
   */
  public List<MeasurementPoint> aggregateByInterval(
      List<MeasurementPoint> points, SamplingInterval interval) {
    Objects.requireNonNull(interval, "interval");
    if (points == null || points.isEmpty()) {
      return List.of();
    }
    if (interval == SamplingInterval.ONE_SECOND) {
      return points;
    }

    List<MeasurementPoint> ordered = new ArrayList<>(points);
    ordered.sort(Comparator.comparingLong(MeasurementPoint::getTimestamp));
    long width = interval.width().toMillis();
    long start = ordered.get(0).getTimestamp();

    List<MeasurementPoint> aggregated = new ArrayList<>();
    List<MeasurementPoint> bucket = new ArrayList<>();
    long bucketIndex = 0;
    for (MeasurementPoint p : ordered) {
      long index = (p.getTimestamp() - start) / width;
      if (index != bucketIndex && !bucket.isEmpty()) {
        aggregated.add(average(bucket, start + bucketIndex * width + width / 2));
        bucket.clear();
      }
      bucketIndex = index;
      bucket.add(p);
    }
    if (!bucket.isEmpty()) {
      aggregated.add(average(bucket, start + bucketIndex * width + width / 2));
    }

    log.debug(
        "Interval {} aggregation: {} -> {} points", interval, points.size(), aggregated.size());
    return aggregated;
  }

  private static MeasurementPoint average(List<MeasurementPoint> bucket, long timestamp) {
    double responseTime = 0;
    double throughput = 0;
    double errorRate = 0;
    double activeUsers = 0;
    for (MeasurementPoint p : bucket) {
      responseTime += p.getResponseTime();
      throughput += p.getThroughput();
      errorRate += p.getErrorRate();
      activeUsers += p.getActiveUsers();
    }
    int n = bucket.size();
    return bucket.get(0).toBuilder()
        .timestamp(timestamp)
        .responseTime(responseTime / n)
        .throughput(throughput / n)
        .errorRate(errorRate / n)
        .activeUsers((int) Math.round(activeUsers / n))
        .build();
  }
}
