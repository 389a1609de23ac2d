package com.mk.fx.qa.load.telemetry.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.load.telemetry.model.AggregateMetrics;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import com.mk.fx.qa.load.telemetry.model.RawEvent;
import com.mk.fx.qa.load.telemetry.model.ValidationRules;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts the raw payload shapes emitted by the push channel, the status poll and the background
 * worker into canonical records.
 *
 * <p>Normalization never rejects a payload: absent fields fall back to safe defaults, numeric
 * fields are clamped into the configured {@link ValidationRules} and stale timestamps are
 * re-stamped with the current time. The only side input is the wall clock.
 */
@Slf4j
public class TelemetryNormalizer {

  private final ValidationRules rules;
  private final Clock clock;

  public TelemetryNormalizer(ValidationRules rules, Clock clock) {
    this.rules = Objects.requireNonNull(rules, "rules");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public TelemetryNormalizer(ValidationRules rules) {
    this(rules, Clock.systemUTC());
  }

  public NormalizedBatch normalize(RawEvent event) {
    Objects.requireNonNull(event, "event");
    long now = clock.millis();
    return switch (event.source()) {
      case PUSH_CHANNEL -> fromPushEvent(event.payload(), now);
      case POLL_RESPONSE -> fromPollResponse(event.payload(), now);
      case WORKER_STATUS -> fromWorkerStatus(event.payload(), now);
    };
  }

  // { dataPoint: {...}, metrics?: {...} }
  private NormalizedBatch fromPushEvent(JsonNode payload, long now) {
    List<MeasurementPoint> points = new ArrayList<>(1);
    if (RawFields.present(payload, "dataPoint") && payload.get("dataPoint").isObject()) {
      points.add(toPoint(payload.get("dataPoint"), now));
    }
    return new NormalizedBatch(points, metricsOrNull(payload, "metrics", now));
  }

  // { success, data?: { realTimeMetrics?, realTimeData?: [...] } }
  private NormalizedBatch fromPollResponse(JsonNode payload, long now) {
    if (!RawFields.bool(payload, "success").orElse(false)) {
      log.debug("Poll response without success flag, nothing to normalize");
      return NormalizedBatch.empty();
    }
    JsonNode data = payload.get("data");
    if (data == null || !data.isObject()) {
      return NormalizedBatch.empty();
    }
    return new NormalizedBatch(
        toPoints(data.get("realTimeData"), now), metricsOrNull(data, "realTimeMetrics", now));
  }

  // { realTimeData?: [...], metrics?: {...} }
  private NormalizedBatch fromWorkerStatus(JsonNode payload, long now) {
    return new NormalizedBatch(
        toPoints(payload.get("realTimeData"), now), metricsOrNull(payload, "metrics", now));
  }

  private List<MeasurementPoint> toPoints(JsonNode array, long now) {
    if (array == null || !array.isArray()) {
      return List.of();
    }
    List<MeasurementPoint> points = new ArrayList<>(array.size());
    for (JsonNode item : array) {
      if (item != null && item.isObject()) {
        points.add(toPoint(item, now));
      }
    }
    return points;
  }

  MeasurementPoint toPoint(JsonNode raw, long now) {
    OptionalDouble rawStatus = RawFields.firstNumber(raw, "status", "statusCode");
    OptionalDouble explicitStatus =
        rawStatus.isPresent() && rawStatus.getAsDouble() > 0 ? rawStatus : OptionalDouble.empty();
    boolean succeeded =
        RawFields.bool(raw, "success").orElseGet(() -> impliesSuccess(explicitStatus));
    double status = explicitStatus.orElse(succeeded ? 200 : 500);

    return MeasurementPoint.builder()
        .timestamp(timestamp(raw, now))
        .responseTime(rules.responseTime().clamp(RawFields.number(raw, "responseTime")))
        .throughput(
            rules.throughput().clamp(RawFields.firstNumber(raw, "throughput", "rps").orElse(0.0)))
        .activeUsers((int) rules.activeUsers().clamp(RawFields.number(raw, "activeUsers")))
        .errorRate(rules.errorRate().clamp(RawFields.number(raw, "errorRate")))
        .statusCode((int) rules.statusCode().clamp(status))
        .succeeded(succeeded)
        .phase(PhaseMapper.map(RawFields.text(raw, "phase").orElse(null)))
        .build();
  }

  private AggregateMetrics metricsOrNull(JsonNode parent, String field, long now) {
    JsonNode raw = parent == null ? null : parent.get(field);
    if (raw == null || !raw.isObject()) {
      return null;
    }
    return toMetrics(raw, now);
  }

  AggregateMetrics toMetrics(JsonNode raw, long now) {
    long total = count(RawFields.number(raw, "totalRequests"));
    long successful = count(RawFields.number(raw, "successfulRequests"));
    long failed =
        count(
            RawFields.optionalNumber(raw, "failedRequests")
                .orElse(Math.max(0, total - successful)));
    double current =
        RawFields.firstNumber(raw, "currentThroughput", "currentTPS", "throughput").orElse(0.0);
    double peak = RawFields.firstNumber(raw, "peakThroughput", "peakTPS").orElse(current);

    return new AggregateMetrics(
        total,
        successful,
        failed,
        rules.responseTime().clamp(RawFields.number(raw, "averageResponseTime")),
        rules.throughput().clamp(current),
        rules.throughput().clamp(peak),
        rules.errorRate().clamp(RawFields.number(raw, "errorRate")),
        (int) rules.activeUsers().clamp(RawFields.number(raw, "activeUsers")),
        timestamp(raw, now));
  }

  private long timestamp(JsonNode raw, long now) {
    var ts = RawFields.epochMillis(raw, "timestamp");
    if (ts.isEmpty() || ts.get() <= 0) {
      return now;
    }
    if (now - ts.get() > rules.maxAge().toMillis()) {
      log.debug("Re-stamping stale timestamp {} (age {}ms)", ts.get(), now - ts.get());
      return now;
    }
    return ts.get();
  }

  private static boolean impliesSuccess(OptionalDouble status) {
    if (status.isEmpty()) {
      return true;
    }
    return status.getAsDouble() < 400;
  }

  private static long count(double value) {
    return Double.isFinite(value) ? Math.max(0L, (long) value) : 0L;
  }
}
