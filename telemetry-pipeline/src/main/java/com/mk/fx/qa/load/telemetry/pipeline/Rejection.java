package com.mk.fx.qa.load.telemetry.pipeline;

import com.mk.fx.qa.load.telemetry.validate.RejectReason;

/**
 * One record dropped by validation.
 *
 * @param recordType {@code "point"} or {@code "metrics"}
 * @param index position of the point in the normalized batch, -1 for metrics
 * @param reason why it was rejected
 */
public record Rejection(String recordType, int index, RejectReason reason) {}
