package com.mk.fx.qa.load.telemetry.downsample;

import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import java.util.List;

/**
 * Scores how much each point shapes the visible curve. Interior points score the weighted sum of
 * absolute differences to both neighbours; the two boundary points get {@code 1.5 * max} so they
 * always rank first.
 */
final class ImportanceScorer {

  static final double RESPONSE_TIME_WEIGHT = 0.4;
  static final double THROUGHPUT_WEIGHT = 0.4;
  static final double ERROR_RATE_WEIGHT = 0.2;
  static final double BOUNDARY_BOOST = 1.5;

  private ImportanceScorer() {
    // Utility class, no instantiation
  }

  static double[] score(List<MeasurementPoint> points) {
    int n = points.size();
    double[] scores = new double[n];
    if (n == 0) {
      return scores;
    }

    double max = 0;
    for (int i = 1; i < n - 1; i++) {
      MeasurementPoint prev = points.get(i - 1);
      MeasurementPoint cur = points.get(i);
      MeasurementPoint next = points.get(i + 1);
      double s =
          RESPONSE_TIME_WEIGHT
                  * delta(prev.getResponseTime(), cur.getResponseTime(), next.getResponseTime())
              + THROUGHPUT_WEIGHT
                  * delta(prev.getThroughput(), cur.getThroughput(), next.getThroughput())
              + ERROR_RATE_WEIGHT
                  * delta(prev.getErrorRate(), cur.getErrorRate(), next.getErrorRate());
      scores[i] = s;
      max = Math.max(max, s);
    }

    // flat series still need the boundaries ranked first
    double boundary = max > 0 ? BOUNDARY_BOOST * max : 1.0;
    scores[0] = boundary;
    scores[n - 1] = boundary;
    return scores;
  }

  private static double delta(double prev, double cur, double next) {
    return Math.abs(cur - prev) + Math.abs(cur - next);
  }
}
