package com.mk.fx.qa.load.telemetry.clean;

/**
 * Single-pass mean and population variance (Welford). Not thread-safe; use one instance per batch
 * or per stream.
 */
public final class RunningStats {

  private long count;
  private double mean;
  private double m2;

  public void add(double value) {
    count++;
    double delta = value - mean;
    mean += delta / count;
    m2 += delta * (value - mean);
  }

  public long count() {
    return count;
  }

  public double mean() {
    return count == 0 ? 0.0 : mean;
  }

  public double variance() {
    return count == 0 ? 0.0 : m2 / count;
  }

  public double standardDeviation() {
    return Math.sqrt(variance());
  }
}
