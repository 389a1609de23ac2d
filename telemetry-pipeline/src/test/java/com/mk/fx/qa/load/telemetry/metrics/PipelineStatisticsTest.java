package com.mk.fx.qa.load.telemetry.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.telemetry.pipeline.ErrorKind;
import com.mk.fx.qa.load.telemetry.pipeline.PipelineError;
import com.mk.fx.qa.load.telemetry.validate.RejectReason;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class PipelineStatisticsTest {

  @Test
  void snapshot_countsAcceptedAndRejectedPerReason() {
    var stats = new PipelineStatistics();
    stats.recordEventReceived();
    stats.recordPointAccepted();
    stats.recordPointAccepted();
    stats.recordPointRejected(RejectReason.MISSING_PHASE);
    stats.recordPointRejected(RejectReason.MISSING_PHASE);
    stats.recordMetricsAccepted();
    stats.recordMetricsRejected(RejectReason.NEGATIVE_COUNT);

    var snapshot = stats.snapshot();

    assertEquals(1, snapshot.eventsReceived());
    assertEquals(2, snapshot.pointsAccepted());
    assertEquals(2, snapshot.pointsRejected());
    assertEquals(1, snapshot.metricsAccepted());
    assertEquals(1, snapshot.metricsRejected());
    assertEquals(2L, snapshot.rejectionBreakdown().get(RejectReason.MISSING_PHASE));
    assertEquals(1L, snapshot.rejectionBreakdown().get(RejectReason.NEGATIVE_COUNT));
    assertEquals(3, stats.totalRejected());
  }

  @Test
  void recordFailure_breakdownAndSamplesCapped() {
    var stats = new PipelineStatistics();
    for (int i = 0; i < 8; i++) {
      stats.recordFailure(new PipelineError(ErrorKind.CLEANING_FAILED, "X", "boom " + i));
    }
    stats.recordFailure(new PipelineError(ErrorKind.MALFORMED_PAYLOAD, "Y", "bad json"));

    var snapshot = stats.snapshot();

    assertEquals(9, snapshot.totalFailures());
    assertEquals(8L, snapshot.failureBreakdown().get(ErrorKind.CLEANING_FAILED));
    assertEquals(1L, snapshot.failureBreakdown().get(ErrorKind.MALFORMED_PAYLOAD));
    assertEquals(5, snapshot.failureSamples().size());
    assertEquals("boom 0", snapshot.failureSamples().get(0).message());
  }

  @Test
  void cacheStatistics_hitRateCompressionAndReset() {
    var stats = new PipelineStatistics();
    stats.bindCacheSize(() -> 7L);
    assertEquals(1.0, stats.averageCompressionRatio());

    stats.recordCacheMiss();
    stats.recordOptimization(2.0, false);
    stats.recordOptimization(4.0, true);

    var snapshot = stats.snapshot();
    assertEquals(2, snapshot.optimizations());
    assertEquals(1, snapshot.cacheHits());
    assertEquals(1, snapshot.cacheMisses());
    assertEquals(0.5, snapshot.cacheHitRate());
    assertEquals(3.0, snapshot.averageCompressionRatio(), 1e-9);
    assertEquals(7, snapshot.cacheSize());

    stats.resetCacheStatistics();
    var reset = stats.snapshot();
    assertEquals(0, reset.cacheHits());
    assertEquals(0, reset.cacheMisses());
    assertEquals(0.0, reset.cacheHitRate());
    assertEquals(1.0, reset.averageCompressionRatio());
    assertEquals(2, reset.optimizations());
  }

  @Test
  void counters_safeUnderConcurrentProducers() throws Exception {
    var stats = new PipelineStatistics();
    int threads = 8;
    int perThread = 1_000;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch done = new CountDownLatch(threads);
    for (int t = 0; t < threads; t++) {
      pool.execute(
          () -> {
            for (int i = 0; i < perThread; i++) {
              stats.recordPointAccepted();
              stats.recordPointRejected(RejectReason.INVALID_TIMESTAMP);
            }
            done.countDown();
          });
    }
    assertTrue(done.await(10, TimeUnit.SECONDS));
    pool.shutdown();

    var snapshot = stats.snapshot();
    assertEquals((long) threads * perThread, snapshot.pointsAccepted());
    assertEquals(
        (long) threads * perThread,
        snapshot.rejectionBreakdown().get(RejectReason.INVALID_TIMESTAMP));
  }
}
