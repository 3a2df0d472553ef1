package com.gentoro.slotfill.tagger;

import com.gentoro.slotfill.exception.ConfigException;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CRF trainer settings. {@link #toTrainerParams()} renders them with CRFsuite parameter names.
 *
 * @param algorithm CRFsuite training algorithm, {@code lbfgs} by default
 * @param c1 L1 regularization coefficient
 * @param c2 L2 regularization coefficient
 * @param maxIterations iteration bound
 * @param possibleTransitions generate transition features for all label pairs
 * @param possibleStates generate state features for all attribute/label pairs
 */
public record CrfParams(
    String algorithm,
    double c1,
    double c2,
    int maxIterations,
    boolean possibleTransitions,
    boolean possibleStates) {

  public static final CrfParams DEFAULTS = new CrfParams("lbfgs", 0.0001, 0.01, 500, true, true);

  public CrfParams {
    if (algorithm == null || algorithm.isBlank()) {
      throw new ConfigException("CRF algorithm is required");
    }
    if (c1 < 0 || c2 < 0 || maxIterations <= 0) {
      throw new ConfigException(
          "Invalid CRF parameters: c1=%s, c2=%s, max_iterations=%d"
              .formatted(c1, c2, maxIterations));
    }
  }

  public Map<String, String> toTrainerParams() {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("c1", plain(c1));
    params.put("c2", plain(c2));
    params.put("max_iterations", Integer.toString(maxIterations));
    params.put("feature.possible_transitions", possibleTransitions ? "1" : "0");
    params.put("feature.possible_states", possibleStates ? "1" : "0");
    return params;
  }

  private static String plain(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
