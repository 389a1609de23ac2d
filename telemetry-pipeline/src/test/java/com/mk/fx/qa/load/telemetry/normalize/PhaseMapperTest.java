package com.mk.fx.qa.load.telemetry.normalize;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.telemetry.model.TestPhase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PhaseMapperTest {

  @ParameterizedTest
  @CsvSource({
    "init, INITIALIZATION",
    "Initializing, INITIALIZATION",
    "ramp-up, RAMP_UP",
    "RampUp, RAMP_UP",
    "RAMP_UP, RAMP_UP",
    "steady, STEADY_STATE",
    "running, STEADY_STATE",
    "ramp-down, RAMP_DOWN",
    "rampDown, RAMP_DOWN",
    "' cleanup ', CLEANUP"
  })
  void map_knownLabels_caseInsensitive(String label, TestPhase expected) {
    assertEquals(expected, PhaseMapper.map(label));
  }

  @Test
  void map_unknownOrMissing_defaultsToSteadyState() {
    assertEquals(TestPhase.STEADY_STATE, PhaseMapper.map(null));
    assertEquals(TestPhase.STEADY_STATE, PhaseMapper.map(""));
    assertEquals(TestPhase.STEADY_STATE, PhaseMapper.map("   "));
    assertEquals(TestPhase.STEADY_STATE, PhaseMapper.map("warming"));
  }
}
