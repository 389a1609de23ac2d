package com.mk.fx.qa.load.telemetry.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class PipelineErrorTest {

  @Test
  void of_usesRootCauseTypeAndOuterMessage() {
    var error =
        PipelineError.of(
            ErrorKind.CLEANING_FAILED,
            new IllegalStateException("stage failed", new ArithmeticException("/ by zero")));

    assertEquals(ErrorKind.CLEANING_FAILED, error.kind());
    assertEquals("ArithmeticException", error.cause());
    assertEquals("stage failed", error.message());
  }

  @Test
  void of_fallsBackToRootMessageThenTypeName() {
    var wrapped =
        PipelineError.of(
            ErrorKind.DOWNSAMPLING_FAILED,
            new RuntimeException(null, new IllegalArgumentException("bad")));
    assertEquals("bad", wrapped.message());

    var bare = PipelineError.of(ErrorKind.DOWNSAMPLING_FAILED, new NullPointerException());
    assertEquals("NullPointerException occurred", bare.message());
  }
}
