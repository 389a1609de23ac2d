package com.mk.fx.qa.load.telemetry.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.mk.fx.qa.load.telemetry.model.DownsampleResult;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/** Bounded {@link ResultCache} backed by Caffeine, evicting by size and write age. */
@Slf4j
public class CaffeineResultCache implements ResultCache {

  private final Cache<String, DownsampleResult> cache;

  public CaffeineResultCache(long maximumSize, Duration expireAfterWrite) {
    if (maximumSize <= 0) {
      throw new IllegalArgumentException("maximumSize must be > 0");
    }
    Objects.requireNonNull(expireAfterWrite, "expireAfterWrite");
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(expireAfterWrite)
            .build();
    log.info(
        "Downsample result cache initialised with maximumSize={} expireAfterWrite={}",
        maximumSize,
        expireAfterWrite);
  }

  @Override
  public Optional<DownsampleResult> get(String fingerprint) {
    return Optional.ofNullable(cache.getIfPresent(fingerprint));
  }

  @Override
  public void put(String fingerprint, DownsampleResult result) {
    cache.put(fingerprint, result);
  }

  @Override
  public void clear() {
    cache.invalidateAll();
    cache.cleanUp();
  }

  @Override
  public long size() {
    return cache.estimatedSize();
  }
}
