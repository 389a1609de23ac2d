package com.mk.fx.qa.load.telemetry.dto.controllerresponse;

import com.mk.fx.qa.load.telemetry.model.DownsampleStrategy;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import com.mk.fx.qa.load.telemetry.pipeline.PipelineError;
import com.mk.fx.qa.load.telemetry.pipeline.Rejection;
import java.util.List;
import lombok.Data;

/** Downsampled series returned to chart clients. */
@Data
public class SeriesResponse {

  private List<MeasurementPoint> points;
  private int originalCount;
  private int resultCount;
  private double compressionRatio;
  private long processingDurationMs;
  private boolean cacheHit;
  private DownsampleStrategy strategy;
  private int compensatedPoints;
  private int rejectedPoints;
  private boolean partial;
  private List<Rejection> rejections;
  private List<PipelineError> errors;
}
