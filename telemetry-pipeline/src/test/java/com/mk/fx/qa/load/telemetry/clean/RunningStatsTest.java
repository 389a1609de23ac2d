package com.mk.fx.qa.load.telemetry.clean;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RunningStatsTest {

  @Test
  void empty_reportsZeros() {
    var stats = new RunningStats();
    assertEquals(0, stats.count());
    assertEquals(0.0, stats.mean());
    assertEquals(0.0, stats.standardDeviation());
  }

  @Test
  void add_tracksMeanAndPopulationVariance() {
    var stats = new RunningStats();
    for (double v : new double[] {2, 4, 4, 4, 5, 5, 7, 9}) {
      stats.add(v);
    }
    assertEquals(8, stats.count());
    assertEquals(5.0, stats.mean(), 1e-9);
    assertEquals(4.0, stats.variance(), 1e-9);
    assertEquals(2.0, stats.standardDeviation(), 1e-9);
  }
}
