package com.mk.fx.qa.load.telemetry.downsample;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.telemetry.model.DownsampleConfig;
import com.mk.fx.qa.load.telemetry.model.DownsampleStrategy;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import com.mk.fx.qa.load.telemetry.model.TestPhase;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeriesFingerprintTest {

  private static List<MeasurementPoint> series(int n) {
    List<MeasurementPoint> points = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      points.add(
          MeasurementPoint.builder()
              .timestamp(1_000L * i + 1)
              .responseTime(100 + i)
              .throughput(20)
              .phase(TestPhase.STEADY_STATE)
              .build());
    }
    return points;
  }

  @Test
  void of_stableForEqualSeriesAndConfig() {
    var cfg = DownsampleConfig.defaults();
    assertEquals(SeriesFingerprint.of(series(10), cfg), SeriesFingerprint.of(series(10), cfg));
  }

  @Test
  void of_changesWithConfig() {
    var points = series(10);
    var cfg = DownsampleConfig.defaults();
    String base = SeriesFingerprint.of(points, cfg);

    assertNotEquals(base, SeriesFingerprint.of(points, cfg.withMaxPoints(500)));
    assertNotEquals(
        base, SeriesFingerprint.of(points, cfg.withStrategy(DownsampleStrategy.UNIFORM)));
    assertNotEquals(
        base,
        SeriesFingerprint.of(
            points, new DownsampleConfig(cfg.maxPoints(), cfg.strategy(), false, true)));
  }

  @Test
  void of_changesWithSizeAndSampledPoints() {
    var cfg = DownsampleConfig.defaults();
    String base = SeriesFingerprint.of(series(10), cfg);

    assertNotEquals(base, SeriesFingerprint.of(series(11), cfg));

    var middleChanged = series(10);
    middleChanged.get(5).setResponseTime(999);
    assertNotEquals(base, SeriesFingerprint.of(middleChanged, cfg));
  }

  @Test
  void of_ignoresPointsOutsideTheSampledPositions() {
    var cfg = DownsampleConfig.defaults();
    var other = series(10);
    other.get(2).setResponseTime(999);

    assertEquals(SeriesFingerprint.of(series(10), cfg), SeriesFingerprint.of(other, cfg));
  }

  @Test
  void of_cacheEnabledFlagDoesNotAffectKey() {
    var points = series(10);
    var on = new DownsampleConfig(100, DownsampleStrategy.ADAPTIVE, true, true);
    var off = new DownsampleConfig(100, DownsampleStrategy.ADAPTIVE, true, false);
    assertEquals(SeriesFingerprint.of(points, on), SeriesFingerprint.of(points, off));
  }
}
