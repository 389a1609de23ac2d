package com.mk.fx.qa.load.telemetry.pipeline;

/** Stage a pipeline failure was raised in. */
public enum ErrorKind {
  MALFORMED_PAYLOAD,
  NORMALIZATION_FAILED,
  CLEANING_FAILED,
  WINDOWING_FAILED,
  DOWNSAMPLING_FAILED
}
