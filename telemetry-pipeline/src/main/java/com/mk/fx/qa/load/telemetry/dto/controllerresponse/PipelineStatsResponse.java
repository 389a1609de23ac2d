package com.mk.fx.qa.load.telemetry.dto.controllerresponse;

import com.mk.fx.qa.load.telemetry.pipeline.ErrorKind;
import com.mk.fx.qa.load.telemetry.pipeline.PipelineError;
import com.mk.fx.qa.load.telemetry.validate.RejectReason;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Counters of the pipeline since start-up: ingestion volume, rejections per reason, failures per
 * stage and downsample cache efficiency.
 */
@Data
public class PipelineStatsResponse {

  private Instant startedAt;
  private long eventsReceived;
  private long pointsAccepted;
  private long pointsRejected;
  private long metricsAccepted;
  private long metricsRejected;
  private Map<RejectReason, Long> rejectionBreakdown;
  private long totalFailures;
  private Map<ErrorKind, Long> failureBreakdown;
  private List<PipelineError> failureSamples;
  private long optimizations;
  private long cacheHits;
  private long cacheMisses;
  private long cacheSize;
  private double cacheHitRate;
  private double averageCompressionRatio;
}
