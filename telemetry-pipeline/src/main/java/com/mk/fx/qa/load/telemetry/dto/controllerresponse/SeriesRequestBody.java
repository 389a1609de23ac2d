package com.mk.fx.qa.load.telemetry.dto.controllerresponse;

import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.Data;

/**
 * Request to turn accepted points into a chart-ready series. Every option is optional; missing
 * ones fall back to the configured pipeline defaults.
 */
@Data
public class SeriesRequestBody {

  @NotNull private List<MeasurementPoint> points;

  private String strategy;

  @Min(2)
  private Integer maxPoints;

  private Boolean preserveKeyPoints;
  private Boolean cacheEnabled;

  /** {@code all}, {@code 1m} or {@code 5m}. */
  private String timeRange;

  /** {@code 1s}, {@code 5s} or {@code 10s}. */
  private String interval;

  private Boolean removeOutliers;
  @Positive private Double outlierThreshold;

  @Min(0)
  private Integer smoothingWindow;

  private Boolean fillMissingValues;
}
