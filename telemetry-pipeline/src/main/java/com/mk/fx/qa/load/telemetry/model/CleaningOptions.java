package com.mk.fx.qa.load.telemetry.model;

/**
 * Batch cleaning switches.
 *
 * @param removeOutliers drop points whose response time deviates by more than {@code
 *     outlierThreshold} standard deviations from the batch mean
 * @param outlierThreshold standard deviation multiplier
 * @param smoothingWindow half-width of the moving window; values of 1 or less disable smoothing
 * @param fillMissingValues forward-fill single zero gaps in response time and throughput
 */
public record CleaningOptions(
    boolean removeOutliers,
    double outlierThreshold,
    int smoothingWindow,
    boolean fillMissingValues) {

  public CleaningOptions {
    if (!(outlierThreshold > 0)) {
      throw new IllegalArgumentException("outlierThreshold must be > 0");
    }
    if (smoothingWindow < 0) {
      throw new IllegalArgumentException("smoothingWindow must be >= 0");
    }
  }

  public static CleaningOptions defaults() {
    return new CleaningOptions(true, 3.0, 5, true);
  }

  public static CleaningOptions disabled() {
    return new CleaningOptions(false, 3.0, 0, false);
  }
}
