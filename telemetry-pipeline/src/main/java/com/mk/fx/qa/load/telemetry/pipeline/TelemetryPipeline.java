package com.mk.fx.qa.load.telemetry.pipeline;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.telemetry.cache.ResultCache;
import com.mk.fx.qa.load.telemetry.cfg.TelemetryPipelineCfg;
import com.mk.fx.qa.load.telemetry.clean.BatchCleaner;
import com.mk.fx.qa.load.telemetry.downsample.Downsampler;
import com.mk.fx.qa.load.telemetry.metrics.PipelineStatistics;
import com.mk.fx.qa.load.telemetry.metrics.PipelineStatsSnapshot;
import com.mk.fx.qa.load.telemetry.model.AggregateMetrics;
import com.mk.fx.qa.load.telemetry.model.CleaningOptions;
import com.mk.fx.qa.load.telemetry.model.DownsampleConfig;
import com.mk.fx.qa.load.telemetry.model.DownsampleResult;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import com.mk.fx.qa.load.telemetry.model.RawEvent;
import com.mk.fx.qa.load.telemetry.model.SourceType;
import com.mk.fx.qa.load.telemetry.normalize.NormalizedBatch;
import com.mk.fx.qa.load.telemetry.normalize.TelemetryNormalizer;
import com.mk.fx.qa.load.telemetry.series.SeriesWindowing;
import com.mk.fx.qa.load.telemetry.validate.RecordValidator;
import com.mk.fx.qa.load.telemetry.validate.ValidationOutcome;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the telemetry pipeline.
 *
 * <p>Raw events are normalized, validated and counted; accepted batches are cleaned, windowed and
 * downsampled into chart-ready series. Failures inside a stage are logged and returned as {@link
 * PipelineError}s together with whatever the earlier stages produced.
 */
@Slf4j
@Service
public class TelemetryPipeline {

  private final TelemetryPipelineCfg properties;
  private final TelemetryNormalizer normalizer;
  private final RecordValidator validator;
  private final BatchCleaner cleaner;
  private final SeriesWindowing windowing;
  private final Downsampler downsampler;
  private final ResultCache cache;
  private final PipelineStatistics statistics;
  private final ObjectMapper objectMapper;
  private final ThreadPoolExecutor executor;

  public TelemetryPipeline(
      TelemetryPipelineCfg properties,
      TelemetryNormalizer normalizer,
      RecordValidator validator,
      BatchCleaner cleaner,
      SeriesWindowing windowing,
      Downsampler downsampler,
      ResultCache cache,
      PipelineStatistics statistics,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.normalizer = normalizer;
    this.validator = validator;
    this.cleaner = cleaner;
    this.windowing = windowing;
    this.downsampler = downsampler;
    this.cache = cache;
    this.statistics = statistics;
    this.objectMapper = objectMapper;
    this.executor = createExecutor(properties.getAsync().getWorkers());
    statistics.bindCacheSize(cache::size);
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "TelemetryPipeline initialised with maxPoints={} strategy={} asyncThreshold={} workers={}",
        properties.getDownsample().getMaxPoints(),
        properties.getDownsample().getStrategy(),
        properties.getAsync().getThreshold(),
        properties.getAsync().getWorkers());
  }

  private ThreadPoolExecutor createExecutor(int workers) {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("telemetry-downsample-worker-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    ThreadPoolExecutor pool = (ThreadPoolExecutor) newFixedThreadPool(workers, threadFactory);
    pool.setRejectedExecutionHandler(
        (runnable, exec) -> {
          throw new RejectedExecutionException("Downsample workers are shut down");
        });
    return pool;
  }

  // -----------------------------------------------------
  // Ingestion
  // -----------------------------------------------------

  public PipelineResult processPushEvent(JsonNode payload) {
    return process(new RawEvent(SourceType.PUSH_CHANNEL, payload));
  }

  public PipelineResult processPollResponse(JsonNode payload) {
    return process(new RawEvent(SourceType.POLL_RESPONSE, payload));
  }

  public PipelineResult processWorkerStatus(JsonNode payload) {
    return process(new RawEvent(SourceType.WORKER_STATUS, payload));
  }

  /** Parses {@code json} and processes it as an event from {@code source}. */
  public PipelineResult processRaw(SourceType source, String json) {
    statistics.recordEventReceived();
    JsonNode payload;
    try {
      payload = objectMapper.readTree(json == null ? "" : json);
    } catch (JsonProcessingException ex) {
      log.warn("Malformed {} payload: {}", source, ex.getOriginalMessage());
      return fail(PipelineError.of(ErrorKind.MALFORMED_PAYLOAD, ex));
    }
    return normalizeAndValidate(new RawEvent(source, payload));
  }

  public PipelineResult process(RawEvent event) {
    statistics.recordEventReceived();
    if (event == null) {
      log.warn("Discarding null telemetry event");
      return fail(
          new PipelineError(ErrorKind.MALFORMED_PAYLOAD, "NullPointerException", "Event is null"));
    }
    return normalizeAndValidate(event);
  }

  private PipelineResult normalizeAndValidate(RawEvent event) {
    NormalizedBatch batch;
    try {
      batch = normalizer.normalize(event);
    } catch (RuntimeException ex) {
      log.error("Normalization failed for {} event", event.source(), ex);
      return fail(PipelineError.of(ErrorKind.NORMALIZATION_FAILED, ex));
    }

    List<MeasurementPoint> accepted = new ArrayList<>(batch.points().size());
    List<Rejection> rejections = new ArrayList<>();
    List<MeasurementPoint> points = batch.points();
    for (int i = 0; i < points.size(); i++) {
      ValidationOutcome<MeasurementPoint> outcome = validator.validate(points.get(i));
      if (outcome.isAccepted()) {
        accepted.add(outcome.value().orElseThrow());
        statistics.recordPointAccepted();
      } else {
        var reason = outcome.reason().orElseThrow();
        log.warn("Rejected {} point #{}: {}", event.source().alias(), i, reason);
        statistics.recordPointRejected(reason);
        rejections.add(new Rejection("point", i, reason));
      }
    }

    AggregateMetrics metrics = null;
    if (batch.metrics() != null) {
      ValidationOutcome<AggregateMetrics> outcome = validator.validate(batch.metrics());
      if (outcome.isAccepted()) {
        metrics = outcome.value().orElseThrow();
        statistics.recordMetricsAccepted();
      } else {
        var reason = outcome.reason().orElseThrow();
        log.warn("Rejected {} metrics: {}", event.source().alias(), reason);
        statistics.recordMetricsRejected(reason);
        rejections.add(new Rejection("metrics", -1, reason));
      }
    }

    log.debug(
        "Processed {} event: {} points accepted, {} rejected",
        event.source().alias(),
        accepted.size(),
        rejections.size());
    return new PipelineResult(accepted, metrics, rejections, List.of());
  }

  private PipelineResult fail(PipelineError error) {
    statistics.recordFailure(error);
    return PipelineResult.failed(error);
  }

  // -----------------------------------------------------
  // Series preparation
  // -----------------------------------------------------

  /**
   * Validates, cleans, windows and downsamples a batch of points. Points failing validation are
   * dropped and reported as {@link Rejection}s. A failing stage is skipped and reported; the stages
   * after it run on the last good output.
   */
  public SeriesResult prepareSeries(SeriesRequest request) {
    if (request == null) {
      log.warn("Discarding null series request");
      PipelineError error =
          record(
              new PipelineError(
                  ErrorKind.MALFORMED_PAYLOAD, "NullPointerException", "Series request is null"));
      return new SeriesResult(
          DownsampleResult.passThrough(List.of(), properties.getDownsample().getStrategy(), 0),
          List.of(error));
    }

    List<PipelineError> errors = new ArrayList<>();
    List<Rejection> rejections = new ArrayList<>();
    List<MeasurementPoint> series = acceptedPoints(request.points(), rejections);

    CleaningOptions cleaning =
        request.cleaning() != null ? request.cleaning() : properties.toCleaningOptions();
    try {
      series = cleaner.clean(series, cleaning);
    } catch (RuntimeException ex) {
      log.error("Cleaning failed for {} points", series.size(), ex);
      errors.add(record(PipelineError.of(ErrorKind.CLEANING_FAILED, ex)));
    }

    try {
      if (request.timeRange() != null) {
        series = windowing.filterByTimeRange(series, request.timeRange());
      }
      if (request.interval() != null) {
        series = windowing.aggregateByInterval(series, request.interval());
      }
    } catch (RuntimeException ex) {
      log.error("Windowing failed for {} points", series.size(), ex);
      errors.add(record(PipelineError.of(ErrorKind.WINDOWING_FAILED, ex)));
    }

    DownsampleConfig config =
        request.downsample() != null ? request.downsample() : properties.toDownsampleConfig();
    return new SeriesResult(downsample(series, config, errors), rejections, errors);
  }

  private List<MeasurementPoint> acceptedPoints(
      List<MeasurementPoint> points, List<Rejection> rejections) {
    List<MeasurementPoint> accepted = new ArrayList<>(points.size());
    for (int i = 0; i < points.size(); i++) {
      ValidationOutcome<MeasurementPoint> outcome = validator.validate(points.get(i));
      if (outcome.isAccepted()) {
        accepted.add(outcome.value().orElseThrow());
      } else {
        var reason = outcome.reason().orElseThrow();
        statistics.recordPointRejected(reason);
        rejections.add(new Rejection("point", i, reason));
      }
    }
    if (!rejections.isEmpty()) {
      log.warn(
          "Dropped {} of {} series points failing validation: {}",
          rejections.size(),
          points.size(),
          rejections.get(0).reason());
    }
    return accepted;
  }

  private DownsampleResult downsample(
      List<MeasurementPoint> series, DownsampleConfig config, List<PipelineError> errors) {
    long start = System.currentTimeMillis();
    try {
      return downsampler.optimize(series, config);
    } catch (RuntimeException ex) {
      log.error("Downsampling failed for {} points, returning them as-is", series.size(), ex);
      errors.add(record(PipelineError.of(ErrorKind.DOWNSAMPLING_FAILED, ex)));
      return DownsampleResult.passThrough(
          series, config.strategy(), System.currentTimeMillis() - start);
    }
  }

  private PipelineError record(PipelineError error) {
    statistics.recordFailure(error);
    return error;
  }

  /**
   * Downsamples {@code points} on the worker pool when the batch is larger than the configured
   * threshold; smaller batches complete on the calling thread.
   */
  public CompletableFuture<SeriesResult> optimizeAsync(
      List<MeasurementPoint> points, DownsampleConfig config) {
    DownsampleConfig effective = config != null ? config : properties.toDownsampleConfig();
    SeriesRequest request =
        new SeriesRequest(points, CleaningOptions.disabled(), null, null, effective);
    if (request.points().size() <= properties.getAsync().getThreshold()) {
      return CompletableFuture.completedFuture(prepareSeries(request));
    }
    try {
      return CompletableFuture.supplyAsync(() -> prepareSeries(request), executor);
    } catch (RejectedExecutionException ex) {
      log.warn("Worker pool rejected {} points, downsampling inline", request.points().size());
      return CompletableFuture.completedFuture(prepareSeries(request));
    }
  }

  // -----------------------------------------------------
  // Cache & statistics
  // -----------------------------------------------------

  public void clearCache() {
    cache.clear();
    statistics.resetCacheStatistics();
    log.info("Downsample cache cleared");
  }

  public PipelineStatsSnapshot statistics() {
    return statistics.snapshot();
  }

  @VisibleForTesting
  boolean isAcceptingAsyncWork() {
    return !executor.isShutdown();
  }

  public void shutdown() {
    if (!executor.isShutdown()) {
      executor.shutdown();
      log.info("Telemetry downsample workers shut down");
    }
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }
}
