package com.mk.fx.qa.load.telemetry.normalize;

import com.mk.fx.qa.load.telemetry.model.TestPhase;
import java.util.Locale;
import java.util.Map;

/** Maps free-text phase labels reported by the load engines onto {@link TestPhase}. */
public final class PhaseMapper {

  private static final Map<String, TestPhase> LABELS =
      Map.ofEntries(
          Map.entry("init", TestPhase.INITIALIZATION),
          Map.entry("initializing", TestPhase.INITIALIZATION),
          Map.entry("initialization", TestPhase.INITIALIZATION),
          Map.entry("ramp-up", TestPhase.RAMP_UP),
          Map.entry("rampup", TestPhase.RAMP_UP),
          Map.entry("ramp_up", TestPhase.RAMP_UP),
          Map.entry("steady", TestPhase.STEADY_STATE),
          Map.entry("steady-state", TestPhase.STEADY_STATE),
          Map.entry("steady_state", TestPhase.STEADY_STATE),
          Map.entry("running", TestPhase.STEADY_STATE),
          Map.entry("ramp-down", TestPhase.RAMP_DOWN),
          Map.entry("rampdown", TestPhase.RAMP_DOWN),
          Map.entry("ramp_down", TestPhase.RAMP_DOWN),
          Map.entry("cleanup", TestPhase.CLEANUP));

  private PhaseMapper() {
    // Utility class, no instantiation
  }

  /** Unknown, blank or missing labels map to {@link TestPhase#STEADY_STATE}. */
  public static TestPhase map(String label) {
    if (label == null || label.isBlank()) {
      return TestPhase.STEADY_STATE;
    }
    return LABELS.getOrDefault(label.trim().toLowerCase(Locale.ROOT), TestPhase.STEADY_STATE);
  }
}
