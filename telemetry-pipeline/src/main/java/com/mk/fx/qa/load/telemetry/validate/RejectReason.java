package com.mk.fx.qa.load.telemetry.validate;

/** Why a canonical record was kept out of the pipeline. */
public enum RejectReason {
  NULL_RECORD,
  INVALID_TIMESTAMP,
  RESPONSE_TIME_OUT_OF_RANGE,
  THROUGHPUT_OUT_OF_RANGE,
  ACTIVE_USERS_OUT_OF_RANGE,
  ERROR_RATE_OUT_OF_RANGE,
  STATUS_CODE_OUT_OF_RANGE,
  MISSING_PHASE,
  NEGATIVE_COUNT
}
