package com.gentoro.slotfill.tagger;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.slotfill.exception.ConfigException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CrfParamsTest {

  @Test
  void defaultTrainerParams() {
    Map<String, String> params = CrfParams.DEFAULTS.toTrainerParams();
    assertEquals(
        Map.of(
            "c1", "0.0001",
            "c2", "0.01",
            "max_iterations", "500",
            "feature.possible_transitions", "1",
            "feature.possible_states", "1"),
        params);
    assertEquals(
        List.of(
            "c1",
            "c2",
            "max_iterations",
            "feature.possible_transitions",
            "feature.possible_states"),
        List.copyOf(params.keySet()));
    assertEquals("lbfgs", CrfParams.DEFAULTS.algorithm());
  }

  @Test
  void rendersWithoutExponentOrTrailingZeros() {
    CrfParams p = new CrfParams("lbfgs", 0.00001, 1.0, 20, false, true);
    Map<String, String> params = p.toTrainerParams();
    assertEquals("0.00001", params.get("c1"));
    assertEquals("1", params.get("c2"));
    assertEquals("0", params.get("feature.possible_transitions"));
  }

  @Test
  void rejectsNegativeRegularization() {
    assertThrows(ConfigException.class, () -> new CrfParams("lbfgs", -1, 0.01, 500, true, true));
    assertThrows(ConfigException.class, () -> new CrfParams(" ", 0, 0.01, 500, true, true));
  }
}
