package com.mk.fx.qa.load.telemetry.resource;

import com.mk.fx.qa.load.telemetry.cfg.TelemetryPipelineCfg;
import com.mk.fx.qa.load.telemetry.dto.controllerresponse.IngestionResponse;
import com.mk.fx.qa.load.telemetry.dto.controllerresponse.PipelineStatsResponse;
import com.mk.fx.qa.load.telemetry.dto.controllerresponse.SeriesRequestBody;
import com.mk.fx.qa.load.telemetry.dto.controllerresponse.SeriesResponse;
import com.mk.fx.qa.load.telemetry.model.SourceType;
import com.mk.fx.qa.load.telemetry.pipeline.ErrorKind;
import com.mk.fx.qa.load.telemetry.pipeline.PipelineResult;
import com.mk.fx.qa.load.telemetry.pipeline.SeriesRequest;
import com.mk.fx.qa.load.telemetry.pipeline.SeriesResult;
import com.mk.fx.qa.load.telemetry.pipeline.TelemetryPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(
    name = "Telemetry",
    description = "Endpoints for ingesting load-test telemetry and preparing chart series")
@RestController
@RequestMapping("/api/telemetry")
@Validated
@RequiredArgsConstructor
public class TelemetryController {

  private final TelemetryPipeline pipeline;
  private final TelemetryPipelineCfg properties;
  private final TelemetryMapper mapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Ingestion
  // -----------------------------------------------------
  @Operation(
      summary = "Ingest a raw telemetry event",
      description =
          "Normalizes and validates one payload from the push channel, the status poll or the"
              + " background worker.")
  @PostMapping(value = "/events/{source}", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<IngestionResponse> ingest(
      @PathVariable String source, @RequestBody String payload) {
    SourceType sourceType = SourceType.fromValue(source);
    PipelineResult result = pipeline.processRaw(sourceType, payload);
    IngestionResponse response = mapper.toIngestionResponse(result, sourceType.alias());

    boolean malformed =
        result.errors().stream().anyMatch(e -> e.kind() == ErrorKind.MALFORMED_PAYLOAD);
    if (malformed) {
      return responseFactory.badRequest(response);
    }
    log.debug(
        "Ingested {} event: accepted={} rejected={}",
        sourceType.alias(),
        response.getAcceptedPoints(),
        response.getRejectedRecords());
    return responseFactory.ok(response);
  }

  // -----------------------------------------------------
  // Series preparation
  // -----------------------------------------------------
  @Operation(
      summary = "Prepare a chart series",
      description =
          "Validates, cleans, windows and downsamples a batch of points. Points failing"
              + " validation are dropped and listed under rejections.")
  @PostMapping("/series")
  public ResponseEntity<SeriesResponse> prepareSeries(@Valid @RequestBody SeriesRequestBody body) {
    SeriesRequest request =
        mapper.toSeriesRequest(
            body, properties.toCleaningOptions(), properties.toDownsampleConfig());
    SeriesResult result = pipeline.prepareSeries(request);
    log.info(
        "Prepared series {} -> {} points (rejected={}, strategy={}, cacheHit={})",
        result.result().originalCount(),
        result.result().resultCount(),
        result.rejections().size(),
        result.result().strategy(),
        result.result().cacheHit());
    return responseFactory.ok(mapper.toSeriesResponse(result));
  }

  // -----------------------------------------------------
  // Statistics & cache
  // -----------------------------------------------------
  @Operation(summary = "Pipeline statistics", description = "Returns counters since start-up.")
  @GetMapping("/stats")
  public ResponseEntity<PipelineStatsResponse> statistics() {
    return responseFactory.ok(mapper.toStatsResponse(pipeline.statistics()));
  }

  @Operation(
      summary = "Clear downsample cache",
      description = "Drops cached series and resets cache counters.")
  @DeleteMapping("/cache")
  public ResponseEntity<Void> clearCache() {
    pipeline.clearCache();
    return responseFactory.noContent();
  }
}
