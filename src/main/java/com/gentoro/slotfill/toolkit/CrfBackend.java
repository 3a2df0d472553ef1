package com.gentoro.slotfill.toolkit;

import java.nio.file.Path;
import java.util.function.Consumer;

/** External conditional-random-field capability. */
public interface CrfBackend {

  /**
   * New trainer; {@code messageSink} receives the backend's training log lines.
   *
   * @param algorithm training algorithm name (e.g. {@code lbfgs})
   */
  CrfTrainer createTrainer(String algorithm, Consumer<String> messageSink);

  /** Opens a tagger over a model previously written by {@link CrfTrainer#train(Path)}. */
  CrfTagger openTagger(Path modelFile);
}
