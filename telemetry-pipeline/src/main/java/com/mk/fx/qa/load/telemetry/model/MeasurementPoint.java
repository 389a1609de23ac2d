package com.mk.fx.qa.load.telemetry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One sampled instant of a running load test in canonical form.
 *
 * <p>Instances are built by the normalizer and are treated as read-only once accepted. Stages that
 * need to rewrite values (smoothing, gap filling) work on {@link #copy()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MeasurementPoint {

  private long timestamp;
  private double responseTime;
  private int activeUsers;
  private double throughput;
  private double errorRate;
  private int statusCode;
  private boolean succeeded;
  private TestPhase phase;

  public MeasurementPoint copy() {
    return toBuilder().build();
  }
}
