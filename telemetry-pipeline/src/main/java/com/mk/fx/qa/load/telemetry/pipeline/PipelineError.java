package com.mk.fx.qa.load.telemetry.pipeline;

import java.util.Objects;

/**
 * Structured description of a failure that was caught at the pipeline boundary instead of being
 * thrown to the caller.
 *
 * @param kind stage that failed
 * @param cause simple class name of the root cause
 * @param message human readable detail
 */
public record PipelineError(ErrorKind kind, String cause, String message) {

  public PipelineError {
    Objects.requireNonNull(kind, "kind");
  }

  public static PipelineError of(ErrorKind kind, Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    String msg = t.getMessage();
    if (msg == null || msg.equals("null")) {
      msg = root.getMessage();
    }
    if (msg == null || msg.equals("null")) {
      msg = root.getClass().getSimpleName() + " occurred";
    }
    return new PipelineError(kind, root.getClass().getSimpleName(), msg);
  }
}
