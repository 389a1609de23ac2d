package com.mk.fx.qa.load.telemetry.dto.controllerresponse;

import com.mk.fx.qa.load.telemetry.model.AggregateMetrics;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import com.mk.fx.qa.load.telemetry.pipeline.PipelineError;
import com.mk.fx.qa.load.telemetry.pipeline.Rejection;
import java.util.List;
import lombok.Data;

/** Outcome of ingesting one raw telemetry event. */
@Data
public class IngestionResponse {

  private String source;
  private int acceptedPoints;
  private int rejectedRecords;
  private boolean partial;
  private List<MeasurementPoint> points;
  private AggregateMetrics metrics;
  private List<Rejection> rejections;
  private List<PipelineError> errors;
}
