package com.mk.fx.qa.load.telemetry.pipeline;

import com.mk.fx.qa.load.telemetry.model.DownsampleResult;
import java.util.List;

/**
 * Downsampled series plus the points validation dropped from the request and the failures caught
 * while producing it.
 */
public record SeriesResult(
    DownsampleResult result, List<Rejection> rejections, List<PipelineError> errors) {

  public SeriesResult {
    rejections = List.copyOf(rejections);
    errors = List.copyOf(errors);
  }

  public SeriesResult(DownsampleResult result, List<PipelineError> errors) {
    this(result, List.of(), errors);
  }

  public boolean isPartial() {
    return !errors.isEmpty();
  }
}
