package com.mk.fx.qa.load.telemetry.clean;

import com.mk.fx.qa.load.telemetry.model.CleaningOptions;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Batch-level statistical cleaning applied in a fixed order: outlier removal, moving-window
 * smoothing, then one-hop forward fill of zero gaps.
 *
 * <p>Outlier statistics are computed over the whole batch on every call, so the cleaner is meant
 * for bounded, already-buffered batches. The input list and its points are never modified; the
 * returned list holds copies.
 */
@Slf4j
public class BatchCleaner {

  public List<MeasurementPoint> clean(List<MeasurementPoint> points, CleaningOptions options) {
    Objects.requireNonNull(options, "options");
    if (points == null || points.isEmpty()) {
      return List.of();
    }

    List<MeasurementPoint> working = new ArrayList<>(points.size());
    for (MeasurementPoint p : points) {
      if (p != null) {
        working.add(p.copy());
      }
    }

    if (options.removeOutliers()) {
      working = removeOutliers(working, options.outlierThreshold());
    }
    if (options.smoothingWindow() > 1 && working.size() >= options.smoothingWindow()) {
      smooth(working, options.smoothingWindow());
    }
    if (options.fillMissingValues()) {
      fillGaps(working);
    }

    log.debug("Cleaned batch {} -> {} points", points.size(), working.size());
    return working;
  }

  List<MeasurementPoint> removeOutliers(List<MeasurementPoint> points, double threshold) {
    var stats = new RunningStats();
    for (MeasurementPoint p : points) {
      stats.add(p.getResponseTime());
    }
    double mean = stats.mean();
    double limit = threshold * stats.standardDeviation();

    List<MeasurementPoint> kept = new ArrayList<>(points.size());
    for (MeasurementPoint p : points) {
      if (Math.abs(p.getResponseTime() - mean) <= limit) {
        kept.add(p);
      }
    }
    if (kept.size() < points.size()) {
      log.debug(
          "Removed {} outliers (mean={}, limit={})",
          points.size() - kept.size(),
          String.format("%.2f", mean),
          String.format("%.2f", limit));
    }
    return kept;
  }

  /** Interior points only; windows read the un-smoothed values. */
  void smooth(List<MeasurementPoint> points, int window) {
    int size = points.size();
    double[] responseTimes = new double[size];
    double[] throughputs = new double[size];
    for (int i = 0; i < size; i++) {
      responseTimes[i] = points.get(i).getResponseTime();
      throughputs[i] = points.get(i).getThroughput();
    }

    for (int i = window; i < size - window; i++) {
      double rtSum = 0;
      double tpSum = 0;
      for (int j = i - window; j <= i + window; j++) {
        rtSum += responseTimes[j];
        tpSum += throughputs[j];
      }
      int span = 2 * window + 1;
      points.get(i).setResponseTime(rtSum / span);
      points.get(i).setThroughput(tpSum / span);
    }
  }

  /** A zero value after a positive original predecessor takes that predecessor's value. */
  void fillGaps(List<MeasurementPoint> points) {
    double prevResponseTime = 0;
    double prevThroughput = 0;
    for (int i = 0; i < points.size(); i++) {
      MeasurementPoint p = points.get(i);
      double responseTime = p.getResponseTime();
      double throughput = p.getThroughput();
      if (i > 0) {
        if (responseTime == 0 && prevResponseTime > 0) {
          p.setResponseTime(prevResponseTime);
        }
        if (throughput == 0 && prevThroughput > 0) {
          p.setThroughput(prevThroughput);
        }
      }
      prevResponseTime = responseTime;
      prevThroughput = throughput;
    }
  }
}
