package com.mk.fx.qa.load.telemetry.metrics;

import com.mk.fx.qa.load.telemetry.pipeline.PipelineError;
import com.mk.fx.qa.load.telemetry.validate.RejectReason;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide counters for the telemetry pipeline.
 *
 * <p>Tracks what was accepted, what was rejected and why, which stages failed, and how the result
 * cache performs. All methods are safe to call from concurrent producer callbacks. Cache
 * statistics (hits, misses and the average compression ratio) are cleared only through {@link
 * #resetCacheStatistics()}.
 */
@Slf4j
public class PipelineStatistics {

  private final Instant startedAt = Instant.now();
  private final AtomicLong eventsReceived = new AtomicLong();
  private final AtomicLong pointsAccepted = new AtomicLong();
  private final AtomicLong pointsRejected = new AtomicLong();
  private final AtomicLong metricsAccepted = new AtomicLong();
  private final AtomicLong metricsRejected = new AtomicLong();
  private final Map<RejectReason, AtomicLong> rejections = new ConcurrentHashMap<>();
  private final FailureTracker failures = new FailureTracker();

  private final AtomicLong optimizations = new AtomicLong();
  private final AtomicLong cacheHits = new AtomicLong();
  private final AtomicLong cacheMisses = new AtomicLong();
  private final AtomicLong compressionSamples = new AtomicLong();
  private final DoubleAdder compressionRatioSum = new DoubleAdder();

  private volatile LongSupplier cacheSize = () -> 0L;

  public void bindCacheSize(LongSupplier cacheSize) {
    this.cacheSize = cacheSize;
  }

  public void recordEventReceived() {
    eventsReceived.incrementAndGet();
  }

  public void recordPointAccepted() {
    pointsAccepted.incrementAndGet();
  }

  public void recordPointRejected(RejectReason reason) {
    pointsRejected.incrementAndGet();
    rejections.computeIfAbsent(reason, k -> new AtomicLong()).incrementAndGet();
  }

  public void recordMetricsAccepted() {
    metricsAccepted.incrementAndGet();
  }

  public void recordMetricsRejected(RejectReason reason) {
    metricsRejected.incrementAndGet();
    rejections.computeIfAbsent(reason, k -> new AtomicLong()).incrementAndGet();
  }

  public void recordFailure(PipelineError error) {
    failures.record(error);
  }

  public void recordOptimization(double compressionRatio, boolean cacheHit) {
    optimizations.incrementAndGet();
    compressionSamples.incrementAndGet();
    compressionRatioSum.add(compressionRatio);
    if (cacheHit) {
      cacheHits.incrementAndGet();
    }
  }

  public void recordCacheMiss() {
    cacheMisses.incrementAndGet();
  }

  public long totalRejected() {
    return pointsRejected.get() + metricsRejected.get();
  }

  public double averageCompressionRatio() {
    long samples = compressionSamples.get();
    return samples == 0 ? 1.0 : compressionRatioSum.sum() / samples;
  }

  public void resetCacheStatistics() {
    cacheHits.set(0);
    cacheMisses.set(0);
    compressionSamples.set(0);
    compressionRatioSum.reset();
    log.info("Cache statistics reset");
  }

  public PipelineStatsSnapshot snapshot() {
    Map<RejectReason, Long> rejectionMap = new EnumMap<>(RejectReason.class);
    for (var e : rejections.entrySet()) rejectionMap.put(e.getKey(), e.getValue().get());
    return new PipelineStatsSnapshot(
        startedAt,
        eventsReceived.get(),
        pointsAccepted.get(),
        pointsRejected.get(),
        metricsAccepted.get(),
        metricsRejected.get(),
        Map.copyOf(rejectionMap),
        failures.totalFailures(),
        failures.breakdownSnapshot(),
        failures.samplesSnapshot(),
        optimizations.get(),
        cacheHits.get(),
        cacheMisses.get(),
        cacheSize.getAsLong(),
        averageCompressionRatio());
  }
}
