package com.mk.fx.qa.load.telemetry.validate;

import java.util.Optional;

/**
 * Result of checking one record: either the accepted record or the reason it was rejected.
 *
 * @param <T> record type
 */
public final class ValidationOutcome<T> {

  private final T value;
  private final RejectReason reason;

  private ValidationOutcome(T value, RejectReason reason) {
    this.value = value;
    this.reason = reason;
  }

  public static <T> ValidationOutcome<T> accepted(T value) {
    return new ValidationOutcome<>(value, null);
  }

  public static <T> ValidationOutcome<T> rejected(RejectReason reason) {
    return new ValidationOutcome<>(null, reason);
  }

  public boolean isAccepted() {
    return reason == null;
  }

  public Optional<T> value() {
    return Optional.ofNullable(value);
  }

  public Optional<RejectReason> reason() {
    return Optional.ofNullable(reason);
  }

  @Override
  public String toString() {
    return isAccepted() ? "Accepted[" + value + "]" : "Rejected[" + reason + "]";
  }
}
