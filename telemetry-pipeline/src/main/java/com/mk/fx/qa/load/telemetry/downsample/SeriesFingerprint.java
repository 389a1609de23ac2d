package com.mk.fx.qa.load.telemetry.downsample;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.mk.fx.qa.load.telemetry.model.DownsampleConfig;
import com.mk.fx.qa.load.telemetry.model.MeasurementPoint;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Cheap cache key for a series: a digest of its length and of the first, middle and last points,
 * combined with a digest of the downsample configuration. Two different series that agree on
 * those samples collide by construction.
 */
public final class SeriesFingerprint {

  private static final HashFunction HASH = Hashing.murmur3_128();

  private SeriesFingerprint() {
    // Utility class, no instantiation
  }

  public static String of(List<MeasurementPoint> points, DownsampleConfig config) {
    return Hashing.combineOrdered(List.of(structure(points), configuration(config))).toString();
  }

  static HashCode structure(List<MeasurementPoint> points) {
    Hasher hasher = HASH.newHasher().putInt(points.size());
    if (!points.isEmpty()) {
      putPoint(hasher, points.get(0));
      putPoint(hasher, points.get(points.size() / 2));
      putPoint(hasher, points.get(points.size() - 1));
    }
    return hasher.hash();
  }

  static HashCode configuration(DownsampleConfig config) {
    return HASH.newHasher()
        .putInt(config.maxPoints())
        .putString(config.strategy().name(), StandardCharsets.UTF_8)
        .putBoolean(config.preserveKeyPoints())
        .hash();
  }

  private static void putPoint(Hasher hasher, MeasurementPoint p) {
    hasher
        .putLong(p.getTimestamp())
        .putDouble(p.getResponseTime())
        .putDouble(p.getThroughput())
        .putDouble(p.getErrorRate())
        .putInt(p.getActiveUsers());
  }
}
