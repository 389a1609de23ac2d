package com.mk.fx.qa.load.telemetry.downsample;

import com.mk.fx.qa.load.telemetry.cache.ResultCache;
import com.mk.fx.qa.load.telemetry.metrics.PipelineStatistics;
import com.mk.fx.qa.load.telemetry.model.DownsampleConfig;
import com.mk.fx.qa.load.telemetry.model.DownsampleResult;
import com.mk.fx.qa.load.telemetry.model.DownsampleStrategy;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Reduces oversized series to a target number of points for charting.
 *
 * <p>Three strategies are supported:
 *
 * <ul>
 *   <li>{@link DownsampleStrategy#UNIFORM}: fixed stride, first and last point always kept.
 *   <li>{@link DownsampleStrategy#IMPORTANCE}: the highest scoring points by local change.
 *   <li>{@link DownsampleStrategy#ADAPTIVE}: boundaries, a uniform backbone for 70% of the budget
 *       and the most important remaining points for the rest, followed by a compensation pass
 *       that splices in points close to the original mean when the sample mean drifts by more
 *       than 5%.
 * </ul>
 *
 * <p>Every strategy returns points in ascending timestamp order. Results for series larger than
 * the budget are memoized in the injected {@link ResultCache} when the config allows it.
 */
@Slf4j
public class Downsampler {

  static final double UNIFORM_SHARE = 0.7;
  static final double MEAN_TOLERANCE = 0.05;
  static final int MAX_COMPENSATION_POINTS = 10;
  static final double COMPENSATION_SHARE = 0.1;

  private final ResultCache cache;
  private final PipelineStatistics statistics;

  public Downsampler(ResultCache cache, PipelineStatistics statistics) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.statistics = Objects.requireNonNull(statistics, "statistics");
  }

  public DownsampleResult optimize(List<MeasurementPoint> points, DownsampleConfig config) {
    Objects.requireNonNull(config, "config");
    long started = System.nanoTime();
    if (points == null || points.isEmpty()) {
      return DownsampleResult.passThrough(List.of(), config.strategy(), 0);
    }
    if (points.size() <= config.maxPoints()) {
      return DownsampleResult.passThrough(points, config.strategy(), elapsedMs(started));
    }

    List<MeasurementPoint> ordered = orderedByTimestamp(points);

    String fingerprint = null;
    if (config.cacheEnabled()) {
      fingerprint = SeriesFingerprint.of(ordered, config);
      var cached = cache.get(fingerprint);
      if (cached.isPresent()) {
        var hit = cached.get().asCacheHit(elapsedMs(started));
        statistics.recordOptimization(hit.compressionRatio(), true);
        log.debug("Cache hit for series of {} points ({})", ordered.size(), config.strategy());
        return hit;
      }
      statistics.recordCacheMiss();
    }

    Selection selection =
        switch (config.strategy()) {
          case UNIFORM -> new Selection(uniform(ordered.size(), config.maxPoints()), 0);
          case IMPORTANCE -> new Selection(importance(ordered, config.maxPoints()), 0);
          case ADAPTIVE -> adaptive(ordered, config);
        };

    List<MeasurementPoint> sampled = new ArrayList<>(selection.indices().size());
    for (int index : selection.indices()) {
      sampled.add(ordered.get(index).copy());
    }

    double ratio = (double) ordered.size() / sampled.size();
    var result =
        new DownsampleResult(
            sampled,
            ordered.size(),
            sampled.size(),
            ratio,
            elapsedMs(started),
            false,
            config.strategy(),
            selection.compensated());

    statistics.recordOptimization(ratio, false);
    if (fingerprint != null) {
      cache.put(fingerprint, result.detached());
    }
    log.debug(
        "Downsampled {} -> {} points using {} (ratio={}, compensated={}, {}ms)",
        result.originalCount(),
        result.resultCount(),
        config.strategy(),
        String.format("%.2f", ratio),
        selection.compensated(),
        result.processingDurationMs());
    return result;
  }

  /** {@code count} indices at stride {@code n / count}; the last stride index becomes n - 1. */
  TreeSet<Integer> uniform(int n, int count) {
    TreeSet<Integer> indices = new TreeSet<>();
    double stride = (double) n / count;
    for (int i = 0; i < count; i++) {
      indices.add((int) Math.floor(i * stride));
    }
    if (!indices.contains(n - 1)) {
      indices.pollLast();
      indices.add(n - 1);
    }
    return indices;
  }

  TreeSet<Integer> importance(List<MeasurementPoint> points, int count) {
    double[] scores = ImportanceScorer.score(points);
    TreeSet<Integer> indices = new TreeSet<>();
    rankedByScore(scores).limit(count).forEach(indices::add);
    return indices;
  }

  Selection adaptive(List<MeasurementPoint> points, DownsampleConfig config) {
    int n = points.size();
    int budget = config.maxPoints();

    TreeSet<Integer> indices = new TreeSet<>();
    indices.add(0);
    indices.add(n - 1);

    int uniformBudget =
        config.preserveKeyPoints() ? Math.max(2, (int) Math.floor(budget * UNIFORM_SHARE)) : budget;
    double stride = (double) n / uniformBudget;
    for (int i = 0; i < uniformBudget && indices.size() < uniformBudget; i++) {
      indices.add((int) Math.floor(i * stride));
    }

    if (config.preserveKeyPoints()) {
      double[] scores = ImportanceScorer.score(points);
      var ranked = rankedByScore(scores).iterator();
      while (indices.size() < budget && ranked.hasNext()) {
        indices.add(ranked.next());
      }
    }

    int compensated = compensate(points, indices);
    return new Selection(indices, compensated);
  }

  /**
   * Splices unselected points closest to the original mean into the sample when the sample mean
   * drifts beyond tolerance. Adds at most {@code min(10, 10% of sample size)} points.
   */
  int compensate(List<MeasurementPoint> points, TreeSet<Integer> indices) {
    double originalMean = meanResponseTime(points);
    double sampleMean = meanResponseTime(points, indices);
    if (originalMean <= 0 || Math.abs(sampleMean - originalMean) <= MEAN_TOLERANCE * originalMean) {
      return 0;
    }

    int bound =
        Math.min(MAX_COMPENSATION_POINTS, (int) Math.floor(indices.size() * COMPENSATION_SHARE));
    List<Integer> candidates =
        IntStream.range(0, points.size())
            .filter(i -> !indices.contains(i))
            .boxed()
            .sorted(
                Comparator.comparingDouble(
                    (Integer i) -> Math.abs(points.get(i).getResponseTime() - originalMean)))
            .limit(bound)
            .toList();
    indices.addAll(candidates);
    log.debug(
        "Compensated sample mean {} vs original {} with {} points",
        String.format("%.2f", sampleMean),
        String.format("%.2f", originalMean),
        candidates.size());
    return candidates.size();
  }

  private static Stream<Integer> rankedByScore(double[] scores) {
    return IntStream.range(0, scores.length)
        .boxed()
        .sorted(
            Comparator.comparingDouble((Integer i) -> scores[i])
                .reversed()
                .thenComparing(Comparator.naturalOrder()));
  }

  private static double meanResponseTime(List<MeasurementPoint> points) {
    double sum = 0;
    for (MeasurementPoint p : points) {
      sum += p.getResponseTime();
    }
    return points.isEmpty() ? 0.0 : sum / points.size();
  }

  private static double meanResponseTime(List<MeasurementPoint> points, Iterable<Integer> indices) {
    double sum = 0;
    int count = 0;
    for (int i : indices) {
      sum += points.get(i).getResponseTime();
      count++;
    }
    return count == 0 ? 0.0 : sum / count;
  }

  private static List<MeasurementPoint> orderedByTimestamp(List<MeasurementPoint> points) {
    for (int i = 1; i < points.size(); i++) {
      if (points.get(i).getTimestamp() < points.get(i - 1).getTimestamp()) {
        List<MeasurementPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingLong(MeasurementPoint::getTimestamp));
        return sorted;
      }
    }
    return points;
  }

  private static long elapsedMs(long startedNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
  }

  record Selection(TreeSet<Integer> indices, int compensated) {}
}
