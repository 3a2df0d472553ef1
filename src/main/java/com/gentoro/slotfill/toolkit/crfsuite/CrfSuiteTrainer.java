package com.gentoro.slotfill.toolkit.crfsuite;

import com.gentoro.slotfill.exception.StateException;
import com.gentoro.slotfill.exception.TrainingException;
import com.gentoro.slotfill.exception.ValidationException;
import com.gentoro.slotfill.toolkit.CrfTrainer;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import third_party.org.chokkan.crfsuite.StringList;
import third_party.org.chokkan.crfsuite.Trainer;

/**
 * Appended examples live in native memory until {@link #train} runs; the native trainer is released
 * afterwards, whether training succeeded or not.
 */
final class CrfSuiteTrainer implements CrfTrainer {
  private final Trainer trainer;
  private int examples;
  private boolean released;

  CrfSuiteTrainer(String algorithm, Consumer<String> messageSink) {
    this.trainer =
        new Trainer() {
          @Override
          public void message(String msg) {
            messageSink.accept(msg);
          }
        };
    if (!trainer.select(algorithm, CrfSuiteBackend.GRAPHICAL_MODEL)) {
      throw new TrainingException("Unsupported CRFsuite training algorithm: " + algorithm);
    }
  }

  @Override
  public void setParams(Map<String, String> params) {
    ensureOpen();
    params.forEach(trainer::set);
  }

  @Override
  public void append(List<List<String>> features, List<String> labels) {
    if (features.size() != labels.size()) {
      throw new ValidationException(
          "Feature/label length mismatch: %d vs %d".formatted(features.size(), labels.size()));
    }
    ensureOpen();
    StringList yseq = new StringList();
    labels.forEach(yseq::add);
    trainer.append(CrfSuiteBackend.toItemSequence(features), yseq, 0);
    examples++;
  }

  @Override
  public void train(Path modelFile) {
    ensureOpen();
    int status;
    try {
      if (examples == 0) {
        throw new TrainingException("No training examples were appended to the CRF trainer");
      }
      status = trainer.train(modelFile.toString(), -1);
    } finally {
      released = true;
      trainer.delete();
    }
    if (status != 0) {
      throw new TrainingException(
          "CRFsuite training failed", Map.of("status", status, "model", modelFile.toString()));
    }
  }

  boolean isReleased() {
    return released;
  }

  private void ensureOpen() {
    if (released) {
      throw new StateException("CRF trainer was already used for training");
    }
  }
}
