package com.mk.fx.qa.load.telemetry.metrics;

import com.mk.fx.qa.load.telemetry.pipeline.ErrorKind;
import com.mk.fx.qa.load.telemetry.pipeline.PipelineError;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/** Counts caught pipeline failures per {@link ErrorKind} and keeps the first few as samples. */
final class FailureTracker {
  private static final int MAX_FAILURE_SAMPLES = 5;

  private final AtomicLong totalFailures = new AtomicLong();
  private final Map<ErrorKind, AtomicLong> breakdown = new ConcurrentHashMap<>();
  private final List<PipelineError> samples = new CopyOnWriteArrayList<>();

  void record(PipelineError error) {
    totalFailures.incrementAndGet();
    breakdown.computeIfAbsent(error.kind(), k -> new AtomicLong()).incrementAndGet();
    if (samples.size() < MAX_FAILURE_SAMPLES) {
      samples.add(error);
    }
  }

  long totalFailures() {
    return totalFailures.get();
  }

  Map<ErrorKind, Long> breakdownSnapshot() {
    Map<ErrorKind, Long> map = new EnumMap<>(ErrorKind.class);
    for (var e : breakdown.entrySet()) map.put(e.getKey(), e.getValue().get());
    return Map.copyOf(map);
  }

  List<PipelineError> samplesSnapshot() {
    return List.copyOf(samples);
  }
}
