package com.mk.fx.qa.load.telemetry.cfg;

import com.mk.fx.qa.load.telemetry.cache.CaffeineResultCache;
import com.mk.fx.qa.load.telemetry.cache.ResultCache;
import com.mk.fx.qa.load.telemetry.clean.BatchCleaner;
import com.mk.fx.qa.load.telemetry.downsample.Downsampler;
import com.mk.fx.qa.load.telemetry.metrics.PipelineStatistics;
import com.mk.fx.qa.load.telemetry.normalize.TelemetryNormalizer;
import com.mk.fx.qa.load.telemetry.series.SeriesWindowing;
import com.mk.fx.qa.load.telemetry.validate.RecordValidator;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the pipeline stages from {@link TelemetryPipelineCfg}. */
@Configuration
public class PipelineComponentsCfg {

  @Bean
  public Clock telemetryClock() {
    return Clock.systemUTC();
  }

  @Bean
  public TelemetryNormalizer telemetryNormalizer(TelemetryPipelineCfg cfg, Clock telemetryClock) {
    return new TelemetryNormalizer(cfg.toValidationRules(), telemetryClock);
  }

  @Bean
  public RecordValidator recordValidator(TelemetryPipelineCfg cfg) {
    return new RecordValidator(cfg.toValidationRules());
  }

  @Bean
  public BatchCleaner batchCleaner() {
    return new BatchCleaner();
  }

  @Bean
  public SeriesWindowing seriesWindowing() {
    return new SeriesWindowing();
  }

  @Bean
  public PipelineStatistics pipelineStatistics() {
    return new PipelineStatistics();
  }

  @Bean
  public ResultCache downsampleResultCache(TelemetryPipelineCfg cfg) {
    return new CaffeineResultCache(
        cfg.getCache().getMaximumSize(), cfg.getCache().getExpireAfterWrite());
  }

  @Bean
  public Downsampler downsampler(ResultCache downsampleResultCache, PipelineStatistics statistics) {
    return new Downsampler(downsampleResultCache, statistics);
  }
}
