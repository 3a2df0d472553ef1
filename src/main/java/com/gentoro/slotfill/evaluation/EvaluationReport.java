package com.gentoro.slotfill.evaluation;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of scoring a tagger against gold sequences.
 *
 * @param sequences number of evaluated sequences
 * @param tokens number of evaluated tokens
 * @param correct tokens whose predicted label equals the gold label
 * @param labels per-label scores for every non-outside label seen in gold or predictions, sorted
 *     by label
 */
public record EvaluationReport(
    int sequences, int tokens, int correct, Map<String, LabelScore> labels) {

  public EvaluationReport {
    labels = Collections.unmodifiableMap(new TreeMap<>(labels));
  }

  public double tokenAccuracy() {
    return tokens == 0 ? 0.0 : (double) correct / tokens;
  }

  /** Unweighted mean F1 over {@link #labels()}, 0 when there are none. */
  public double macroF1() {
    return labels.values().stream().mapToDouble(LabelScore::f1).average().orElse(0.0);
  }
}
