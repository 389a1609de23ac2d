package com.mk.fx.qa.load.telemetry.cfg;

import com.mk.fx.qa.load.telemetry.model.CleaningOptions;
import com.mk.fx.qa.load.telemetry.model.DownsampleConfig;
import com.mk.fx.qa.load.telemetry.model.DownsampleStrategy;
import com.mk.fx.qa.load.telemetry.model.FieldRange;
import com.mk.fx.qa.load.telemetry.model.ValidationRules;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Pipeline settings bound from {@code telemetry.pipeline.*}.
 *
 * <pre>{@code
 * telemetry:
 *   pipeline:
 *     validation:
 *       response-time-max: 60000
 *       max-age: 5m
 *     cleaning:
 *       outlier-threshold: 3.0
 *       smoothing-window: 5
 *     downsample:
 *       max-points: 1000
 *       strategy: ADAPTIVE
 *     cache:
 *       maximum-size: 256
 *       expire-after-write: 10m
 *     async:
 *       threshold: 5000
 *       workers: 2
 * }</pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "telemetry.pipeline")
public class TelemetryPipelineCfg {

  @Valid private Validation validation = new Validation();
  @Valid private Cleaning cleaning = new Cleaning();
  @Valid private Downsample downsample = new Downsample();
  @Valid private Cache cache = new Cache();
  @Valid private Async async = new Async();

  public ValidationRules toValidationRules() {
    return new ValidationRules(
        FieldRange.of(0, validation.getResponseTimeMax()),
        FieldRange.of(0, validation.getThroughputMax()),
        FieldRange.of(0, validation.getActiveUsersMax()),
        FieldRange.of(0, 100),
        FieldRange.of(validation.getStatusCodeMin(), validation.getStatusCodeMax()),
        validation.getMaxAge());
  }

  public CleaningOptions toCleaningOptions() {
    return new CleaningOptions(
        cleaning.isRemoveOutliers(),
        cleaning.getOutlierThreshold(),
        cleaning.getSmoothingWindow(),
        cleaning.isFillMissingValues());
  }

  public DownsampleConfig toDownsampleConfig() {
    return new DownsampleConfig(
        downsample.getMaxPoints(),
        downsample.getStrategy(),
        downsample.isPreserveKeyPoints(),
        downsample.isCacheEnabled());
  }

  @Data
  public static class Validation {
    @Positive private double responseTimeMax = 60_000;
    @Positive private double throughputMax = 1_000_000;
    @Positive private double activeUsersMax = 1_000_000;
    @Min(0) private int statusCodeMin = 100;
    @Max(999) private int statusCodeMax = 599;
    @NotNull private Duration maxAge = ValidationRules.DEFAULT_MAX_AGE;
  }

  @Data
  public static class Cleaning {
    private boolean removeOutliers = true;
    @Positive private double outlierThreshold = 3.0;
    @Min(0) private int smoothingWindow = 5;
    private boolean fillMissingValues = true;
  }

  @Data
  public static class Downsample {
    @Min(2) private int maxPoints = DownsampleConfig.DEFAULT_MAX_POINTS;
    @NotNull private DownsampleStrategy strategy = DownsampleStrategy.ADAPTIVE;
    private boolean preserveKeyPoints = true;
    private boolean cacheEnabled = true;
  }

  @Data
  public static class Cache {
    @Positive private long maximumSize = 256;
    @NotNull private Duration expireAfterWrite = Duration.ofMinutes(10);
  }

  @Data
  public static class Async {
    @Positive private int threshold = 5000;

    @Min(1)
    @Max(64)
    private int workers = 2;
  }
}
