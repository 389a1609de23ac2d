package com.mk.fx.qa.load.telemetry.model;

/** Closed numeric domain {@code [min, max]} for one field. */
public record FieldRange(double min, double max) {

  public FieldRange {
    if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
      throw new IllegalArgumentException("Invalid range [" + min + ", " + max + "]");
    }
  }

  public static FieldRange of(double min, double max) {
    return new FieldRange(min, max);
  }

  /** Clamps the value into the range; NaN and infinities are treated as 0 first. */
  public double clamp(double value) {
    double v = Double.isFinite(value) ? value : 0.0;
    return Math.max(min, Math.min(max, v));
  }

  public boolean contains(double value) {
    return !Double.isNaN(value) && value >= min && value <= max;
  }
}
