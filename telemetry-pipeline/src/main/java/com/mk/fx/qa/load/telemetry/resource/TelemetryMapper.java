package com.mk.fx.qa.load.telemetry.resource;

import com.mk.fx.qa.load.telemetry.dto.controllerresponse.IngestionResponse;
import com.mk.fx.qa.load.telemetry.dto.controllerresponse.PipelineStatsResponse;
import com.mk.fx.qa.load.telemetry.dto.controllerresponse.SeriesRequestBody;
import com.mk.fx.qa.load.telemetry.dto.controllerresponse.SeriesResponse;
import com.mk.fx.qa.load.telemetry.metrics.PipelineStatsSnapshot;
import com.mk.fx.qa.load.telemetry.model.CleaningOptions;
import com.mk.fx.qa.load.telemetry.model.DownsampleConfig;
import com.mk.fx.qa.load.telemetry.model.DownsampleResult;
import com.mk.fx.qa.load.telemetry.model.DownsampleStrategy;
import com.mk.fx.qa.load.telemetry.pipeline.PipelineError;
import com.mk.fx.qa.load.telemetry.pipeline.PipelineResult;
import com.mk.fx.qa.load.telemetry.pipeline.Rejection;
import com.mk.fx.qa.load.telemetry.pipeline.SeriesRequest;
import com.mk.fx.qa.load.telemetry.pipeline.SeriesResult;
import com.mk.fx.qa.load.telemetry.series.SamplingInterval;
import com.mk.fx.qa.load.telemetry.series.TimeRange;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface TelemetryMapper {

  @Mapping(target = "source", source = "source")
  @Mapping(target = "acceptedPoints", expression = "java(result.points().size())")
  @Mapping(target = "rejectedRecords", expression = "java(result.rejections().size())")
  @Mapping(target = "partial", expression = "java(result.isPartial())")
  @Mapping(target = "points", source = "result.points")
  @Mapping(target = "metrics", source = "result.metrics")
  @Mapping(target = "rejections", source = "result.rejections")
  @Mapping(target = "errors", source = "result.errors")
  IngestionResponse toIngestionResponse(PipelineResult result, String source);

  @Mapping(target = "rejections", source = "rejections")
  @Mapping(target = "rejectedPoints", expression = "java(rejections.size())")
  @Mapping(target = "errors", source = "errors")
  @Mapping(target = "partial", expression = "java(!errors.isEmpty())")
  SeriesResponse toSeriesResponse(
      DownsampleResult result, List<Rejection> rejections, List<PipelineError> errors);

  default SeriesResponse toSeriesResponse(SeriesResult seriesResult) {
    return toSeriesResponse(
        seriesResult.result(), seriesResult.rejections(), seriesResult.errors());
  }

  @Mapping(target = "cacheHitRate", expression = "java(snapshot.cacheHitRate())")
  PipelineStatsResponse toStatsResponse(PipelineStatsSnapshot snapshot);

  /** Overlays the options present in {@code body} on the configured defaults. */
  default SeriesRequest toSeriesRequest(
      SeriesRequestBody body, CleaningOptions defaults, DownsampleConfig downsampleDefaults) {
    CleaningOptions cleaning =
        new CleaningOptions(
            body.getRemoveOutliers() != null
                ? body.getRemoveOutliers()
                : defaults.removeOutliers(),
            body.getOutlierThreshold() != null
                ? body.getOutlierThreshold()
                : defaults.outlierThreshold(),
            body.getSmoothingWindow() != null
                ? body.getSmoothingWindow()
                : defaults.smoothingWindow(),
            body.getFillMissingValues() != null
                ? body.getFillMissingValues()
                : defaults.fillMissingValues());
    DownsampleConfig downsample =
        new DownsampleConfig(
            body.getMaxPoints() != null ? body.getMaxPoints() : downsampleDefaults.maxPoints(),
            body.getStrategy() != null
                ? DownsampleStrategy.fromValue(body.getStrategy())
                : downsampleDefaults.strategy(),
            body.getPreserveKeyPoints() != null
                ? body.getPreserveKeyPoints()
                : downsampleDefaults.preserveKeyPoints(),
            body.getCacheEnabled() != null
                ? body.getCacheEnabled()
                : downsampleDefaults.cacheEnabled());
    return new SeriesRequest(
        body.getPoints(),
        cleaning,
        body.getTimeRange() != null ? TimeRange.fromValue(body.getTimeRange()) : null,
        body.getInterval() != null ? SamplingInterval.fromValue(body.getInterval()) : null,
        downsample);
  }
}
