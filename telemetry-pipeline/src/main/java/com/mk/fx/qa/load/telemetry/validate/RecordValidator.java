package com.mk.fx.qa.load.telemetry.validate;

import com.mk.fx.qa.load.telemetry.model.AggregateMetrics;
import com.mk.fx.qa.load.telemetry.model.FieldRange;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import com.mk.fx.qa.load.telemetry.model.ValidationRules;
import java.util.Objects;

/**
 * Accept/reject gate in front of the batch stages.
 *
 * <p>The normalizer already clamps every field, so a rejection here points at a record that was
 * built outside the normalizer or a bug upstream. Checks run in a fixed order and the first
 * failing one determines the {@link RejectReason}.
 */
public class RecordValidator {

  private final ValidationRules rules;

  public RecordValidator(ValidationRules rules) {
    this.rules = Objects.requireNonNull(rules, "rules");
  }

  public boolean accept(MeasurementPoint point) {
    return validate(point).isAccepted();
  }

  public boolean accept(AggregateMetrics metrics) {
    return validate(metrics).isAccepted();
  }

  public ValidationOutcome<MeasurementPoint> validate(MeasurementPoint point) {
    if (point == null) {
      return ValidationOutcome.rejected(RejectReason.NULL_RECORD);
    }
    if (point.getTimestamp() <= 0) {
      return ValidationOutcome.rejected(RejectReason.INVALID_TIMESTAMP);
    }
    if (outside(rules.responseTime(), point.getResponseTime())) {
      return ValidationOutcome.rejected(RejectReason.RESPONSE_TIME_OUT_OF_RANGE);
    }
    if (outside(rules.throughput(), point.getThroughput())) {
      return ValidationOutcome.rejected(RejectReason.THROUGHPUT_OUT_OF_RANGE);
    }
    if (outside(rules.activeUsers(), point.getActiveUsers())) {
      return ValidationOutcome.rejected(RejectReason.ACTIVE_USERS_OUT_OF_RANGE);
    }
    if (outside(rules.errorRate(), point.getErrorRate())) {
      return ValidationOutcome.rejected(RejectReason.ERROR_RATE_OUT_OF_RANGE);
    }
    if (outside(rules.statusCode(), point.getStatusCode())) {
      return ValidationOutcome.rejected(RejectReason.STATUS_CODE_OUT_OF_RANGE);
    }
    if (point.getPhase() == null) {
      return ValidationOutcome.rejected(RejectReason.MISSING_PHASE);
    }
    return ValidationOutcome.accepted(point);
  }

  public ValidationOutcome<AggregateMetrics> validate(AggregateMetrics metrics) {
    if (metrics == null) {
      return ValidationOutcome.rejected(RejectReason.NULL_RECORD);
    }
    if (metrics.timestamp() <= 0) {
      return ValidationOutcome.rejected(RejectReason.INVALID_TIMESTAMP);
    }
    if (metrics.totalRequests() < 0
        || metrics.successfulRequests() < 0
        || metrics.failedRequests() < 0) {
      return ValidationOutcome.rejected(RejectReason.NEGATIVE_COUNT);
    }
    if (outside(rules.responseTime(), metrics.averageResponseTime())) {
      return ValidationOutcome.rejected(RejectReason.RESPONSE_TIME_OUT_OF_RANGE);
    }
    if (outside(rules.throughput(), metrics.currentThroughput())
        || outside(rules.throughput(), metrics.peakThroughput())) {
      return ValidationOutcome.rejected(RejectReason.THROUGHPUT_OUT_OF_RANGE);
    }
    if (outside(rules.errorRate(), metrics.errorRate())) {
      return ValidationOutcome.rejected(RejectReason.ERROR_RATE_OUT_OF_RANGE);
    }
    if (outside(rules.activeUsers(), metrics.activeUsers())) {
      return ValidationOutcome.rejected(RejectReason.ACTIVE_USERS_OUT_OF_RANGE);
    }
    return ValidationOutcome.accepted(metrics);
  }

  private static boolean outside(FieldRange range, double value) {
    return !range.contains(value);
  }
}
