package com.mk.fx.qa.load.telemetry.series;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import com.mk.fx.qa.load.telemetry.model.TestPhase;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeriesWindowingTest {

  private static final long START = 1_700_000_000_000L;

  private final SeriesWindowing windowing = new SeriesWindowing();

  private static MeasurementPoint point(long offsetMs, double responseTime, int users) {
    return MeasurementPoint.builder()
        .timestamp(START + offsetMs)
        .responseTime(responseTime)
        .throughput(responseTime / 10)
        .activeUsers(users)
        .errorRate(0)
        .statusCode(200)
        .succeeded(true)
        .phase(TestPhase.RAMP_UP)
        .build();
  }

  private static List<MeasurementPoint> everySecond(int seconds) {
    List<MeasurementPoint> points = new ArrayList<>();
    for (int i = 0; i < seconds; i++) {
      points.add(point(i * 1_000L, 100 + i, 10));
    }
    return points;
  }

  @Test
  void filterByTimeRange_keepsTrailingWindowFromLatestPoint() {
    var points = everySecond(120);

    var lastMinute = windowing.filterByTimeRange(points, TimeRange.LAST_MINUTE);

    assertThat(lastMinute)
        .hasSize(61)
        .allMatch(p -> p.getTimestamp() >= START + 59_000)
        .last()
        .extracting(MeasurementPoint::getTimestamp)
        .isEqualTo(START + 119_000);
  }

  @Test
  void filterByTimeRange_shortSeriesAndAllReturnedAsIs() {
    var points = everySecond(30);
    assertSame(points, windowing.filterByTimeRange(points, TimeRange.LAST_FIVE_MINUTES));
    assertSame(points, windowing.filterByTimeRange(points, TimeRange.ALL));
    assertTrue(windowing.filterByTimeRange(List.of(), TimeRange.LAST_MINUTE).isEmpty());
  }

  @Test
  void aggregateByInterval_averagesBucketsAtMidpoint() {
    var points = List.of(point(0, 100, 10), point(2_000, 200, 11), point(6_000, 400, 20));

    var aggregated = windowing.aggregateByInterval(points, SamplingInterval.FIVE_SECONDS);

    assertEquals(2, aggregated.size());
    MeasurementPoint first = aggregated.get(0);
    assertEquals(START + 2_500, first.getTimestamp());
    assertEquals(150.0, first.getResponseTime(), 1e-9);
    assertEquals(15.0, first.getThroughput(), 1e-9);
    assertEquals(11, first.getActiveUsers());
    assertEquals(TestPhase.RAMP_UP, first.getPhase());

    MeasurementPoint last = aggregated.get(1);
    assertEquals(START + 7_500, last.getTimestamp());
    assertEquals(400.0, last.getResponseTime(), 1e-9);
  }

  @Test
  void aggregateByInterval_includesTrailingBucketAndSkipsEmptyOnes() {
    var points = List.of(point(0, 100, 1), point(25_000, 300, 1), point(29_000, 500, 1));

    var aggregated = windowing.aggregateByInterval(points, SamplingInterval.TEN_SECONDS);

    assertEquals(2, aggregated.size());
    assertEquals(START + 25_000, aggregated.get(1).getTimestamp());
    assertEquals(400.0, aggregated.get(1).getResponseTime(), 1e-9);
  }

  @Test
  void aggregateByInterval_oneSecondIsIdentity() {
    var points = everySecond(5);
    assertSame(points, windowing.aggregateByInterval(points, SamplingInterval.ONE_SECOND));
  }

  @Test
  void fromValue_acceptsAliasesAndNames() {
    assertEquals(TimeRange.LAST_MINUTE, TimeRange.fromValue("1m"));
    assertEquals(TimeRange.ALL, TimeRange.fromValue("all"));
    assertEquals(SamplingInterval.TEN_SECONDS, SamplingInterval.fromValue("ten_seconds"));
    assertEquals(SamplingInterval.FIVE_SECONDS, SamplingInterval.fromValue("5s"));
    assertThrows(IllegalArgumentException.class, () -> TimeRange.fromValue("1h"));
  }
}
