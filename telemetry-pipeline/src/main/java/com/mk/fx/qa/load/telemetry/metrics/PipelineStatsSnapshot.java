package com.mk.fx.qa.load.telemetry.metrics;

import com.mk.fx.qa.load.telemetry.pipeline.ErrorKind;
import com.mk.fx.qa.load.telemetry.pipeline.PipelineError;
import com.mk.fx.qa.load.telemetry.validate.RejectReason;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Immutable view of the pipeline counters at a point in time. */
public record PipelineStatsSnapshot(
    Instant startedAt,
    long eventsReceived,
    long pointsAccepted,
    long pointsRejected,
    long metricsAccepted,
    long metricsRejected,
    Map<RejectReason, Long> rejectionBreakdown,
    long totalFailures,
    Map<ErrorKind, Long> failureBreakdown,
    List<PipelineError> failureSamples,
    long optimizations,
    long cacheHits,
    long cacheMisses,
    long cacheSize,
    double averageCompressionRatio) {

  public double cacheHitRate() {
    long lookups = cacheHits + cacheMisses;
    return lookups == 0 ? 0.0 : (double) cacheHits / lookups;
  }
}
