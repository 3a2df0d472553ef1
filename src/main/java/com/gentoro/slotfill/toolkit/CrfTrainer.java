package com.gentoro.slotfill.toolkit;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** One-shot CRF trainer: set parameters, append examples, train once. */
public interface CrfTrainer {

  void setParams(Map<String, String> params);

  /**
   * Add one training example.
   *
   * @param features string attributes per position
   * @param labels one label per position
   */
  void append(List<List<String>> features, List<String> labels);

  /** Train on every appended example and write the model to {@code modelFile}. */
  void train(Path modelFile);
}
