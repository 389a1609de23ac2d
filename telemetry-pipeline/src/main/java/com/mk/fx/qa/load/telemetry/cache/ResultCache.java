package com.mk.fx.qa.load.telemetry.cache;

import com.mk.fx.qa.load.telemetry.model.DownsampleResult;
import java.util.Optional;

/**
 * Memoizes downsample results by series fingerprint. Implementations must be safe for concurrent
 * use since several producer callbacks may share one pipeline.
 */
public interface ResultCache {

  Optional<DownsampleResult> get(String fingerprint);

  void put(String fingerprint, DownsampleResult result);

  void clear();

  long size();
}
