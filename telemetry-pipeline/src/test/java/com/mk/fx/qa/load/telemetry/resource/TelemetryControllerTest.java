package com.mk.fx.qa.load.telemetry.resource;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.mk.fx.qa.load.telemetry.cfg.TelemetryPipelineCfg;
import com.mk.fx.qa.load.telemetry.metrics.PipelineStatsSnapshot;
import com.mk.fx.qa.load.telemetry.model.DownsampleResult;
import com.mk.fx.qa.load.telemetry.model.DownsampleStrategy;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import com.mk.fx.qa.load.telemetry.model.SourceType;
import com.mk.fx.qa.load.telemetry.model.TestPhase;
import com.mk.fx.qa.load.telemetry.pipeline.ErrorKind;
import com.mk.fx.qa.load.telemetry.pipeline.PipelineError;
import com.mk.fx.qa.load.telemetry.pipeline.PipelineResult;
import com.mk.fx.qa.load.telemetry.pipeline.Rejection;
import com.mk.fx.qa.load.telemetry.pipeline.SeriesRequest;
import com.mk.fx.qa.load.telemetry.pipeline.SeriesResult;
import com.mk.fx.qa.load.telemetry.pipeline.TelemetryPipeline;
import com.mk.fx.qa.load.telemetry.series.SamplingInterval;
import com.mk.fx.qa.load.telemetry.series.TimeRange;
import com.mk.fx.qa.load.telemetry.validate.RejectReason;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = TelemetryController.class)
@Import({
  ApiResponseFactory.class,
  GlobalExceptionHandler.class,
  TelemetryMapperImpl.class,
  TelemetryPipelineCfg.class
})
class TelemetryControllerTest {

  @Autowired MockMvc mvc;

  @MockBean TelemetryPipeline pipeline;

  private static MeasurementPoint point(long ts) {
    return MeasurementPoint.builder()
        .timestamp(ts)
        .responseTime(120)
        .throughput(30)
        .activeUsers(5)
        .statusCode(200)
        .succeeded(true)
        .phase(TestPhase.STEADY_STATE)
        .build();
  }

  @Test
  void ingest_pushEventReturnsAcceptedPoints() throws Exception {
    String body = "{\"dataPoint\": {\"responseTime\": 120}}";
    when(pipeline.processRaw(SourceType.PUSH_CHANNEL, body))
        .thenReturn(new PipelineResult(List.of(point(1_000L)), null, List.of(), List.of()));

    mvc.perform(
            post("/api/telemetry/events/push")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.source").value("push"))
        .andExpect(jsonPath("$.acceptedPoints").value(1))
        .andExpect(jsonPath("$.rejectedRecords").value(0))
        .andExpect(jsonPath("$.partial").value(false))
        .andExpect(jsonPath("$.points[0].responseTime").value(120.0));
  }

  @Test
  void ingest_malformedPayloadIsBadRequestWithErrors() throws Exception {
    var error = new PipelineError(ErrorKind.MALFORMED_PAYLOAD, "JsonParseException", "bad");
    when(pipeline.processRaw(eq(SourceType.POLL_RESPONSE), anyString()))
        .thenReturn(new PipelineResult(List.of(), null, List.of(), List.of(error)));

    mvc.perform(
            post("/api/telemetry/events/poll").contentType(MediaType.APPLICATION_JSON).content("{"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.partial").value(true))
        .andExpect(jsonPath("$.errors[0].kind").value("MALFORMED_PAYLOAD"));
  }

  @Test
  void ingest_unknownSourceIsBadRequest() throws Exception {
    mvc.perform(
            post("/api/telemetry/events/socket")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid Argument"));
    verifyNoInteractions(pipeline);
  }

  @Test
  void prepareSeries_reportsPointsDroppedByValidation() throws Exception {
    var points = List.of(point(1_000L));
    var result = DownsampleResult.passThrough(points, DownsampleStrategy.ADAPTIVE, 0);
    var rejection = new Rejection("point", 1, RejectReason.MISSING_PHASE);
    when(pipeline.prepareSeries(any()))
        .thenReturn(new SeriesResult(result, List.of(rejection), List.of()));

    String body =
        "{\"points\": [{\"timestamp\": 1000, \"responseTime\": 120, \"phase\": \"RAMP_UP\"},"
            + " {\"timestamp\": 2000, \"responseTime\": 130}]}";

    mvc.perform(post("/api/telemetry/series").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.resultCount").value(1))
        .andExpect(jsonPath("$.rejectedPoints").value(1))
        .andExpect(jsonPath("$.rejections[0].index").value(1))
        .andExpect(jsonPath("$.rejections[0].reason").value("MISSING_PHASE"))
        .andExpect(jsonPath("$.partial").value(false));
  }

  @Test
  void prepareSeries_mapsOptionsOntoDefaults() throws Exception {
    var points = List.of(point(1_000L), point(3_000L));
    var result =
        new DownsampleResult(points, 3, 2, 1.5, 1, false, DownsampleStrategy.UNIFORM, 0);
    when(pipeline.prepareSeries(any())).thenReturn(new SeriesResult(result, List.of()));

    String body =
        "{\"points\": [{\"timestamp\": 1000, \"responseTime\": 120},"
            + " {\"timestamp\": 2000, \"responseTime\": 130},"
            + " {\"timestamp\": 3000, \"responseTime\": 140}],"
            + " \"strategy\": \"uniform\", \"maxPoints\": 2, \"timeRange\": \"1m\","
            + " \"interval\": \"5s\", \"removeOutliers\": false}";

    mvc.perform(post("/api/telemetry/series").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.resultCount").value(2))
        .andExpect(jsonPath("$.originalCount").value(3))
        .andExpect(jsonPath("$.strategy").value("UNIFORM"))
        .andExpect(jsonPath("$.partial").value(false));

    ArgumentCaptor<SeriesRequest> captor = ArgumentCaptor.forClass(SeriesRequest.class);
    verify(pipeline).prepareSeries(captor.capture());
    SeriesRequest request = captor.getValue();
    assertEquals(3, request.points().size());
    assertEquals(DownsampleStrategy.UNIFORM, request.downsample().strategy());
    assertEquals(2, request.downsample().maxPoints());
    assertTrue(request.downsample().cacheEnabled());
    assertEquals(TimeRange.LAST_MINUTE, request.timeRange());
    assertEquals(SamplingInterval.FIVE_SECONDS, request.interval());
    assertFalse(request.cleaning().removeOutliers());
    assertEquals(5, request.cleaning().smoothingWindow());
  }

  @Test
  void prepareSeries_invalidBodyIsBadRequest() throws Exception {
    mvc.perform(
            post("/api/telemetry/series")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"points\": [], \"maxPoints\": 1}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid Request"));

    mvc.perform(
            post("/api/telemetry/series")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"maxPoints\": 10}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void prepareSeries_unknownStrategyIsBadRequest() throws Exception {
    mvc.perform(
            post("/api/telemetry/series")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"points\": [], \"strategy\": \"random\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.details").value("Unsupported strategy: random"));
  }

  @Test
  void statistics_returnsSnapshot() throws Exception {
    var snapshot =
        new PipelineStatsSnapshot(
            Instant.parse("2026-03-01T12:00:00Z"),
            10,
            8,
            2,
            3,
            0,
            Map.of(RejectReason.MISSING_PHASE, 2L),
            0,
            Map.of(),
            List.of(),
            4,
            3,
            1,
            2,
            2.5);
    when(pipeline.statistics()).thenReturn(snapshot);

    mvc.perform(get("/api/telemetry/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.eventsReceived").value(10))
        .andExpect(jsonPath("$.rejectionBreakdown.MISSING_PHASE").value(2))
        .andExpect(jsonPath("$.cacheHitRate").value(0.75))
        .andExpect(jsonPath("$.averageCompressionRatio").value(2.5));
  }

  @Test
  void clearCache_returnsNoContent() throws Exception {
    mvc.perform(delete("/api/telemetry/cache")).andExpect(status().isNoContent());
    verify(pipeline).clearCache();
  }
}
