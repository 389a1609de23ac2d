package com.mk.fx.qa.load.telemetry.model;

/** Lifecycle stage of a running load test that a measurement belongs to. */
public enum TestPhase {
  INITIALIZATION,
  RAMP_UP,
  STEADY_STATE,
  RAMP_DOWN,
  CLEANUP
}
