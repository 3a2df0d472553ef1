package com.gentoro.slotfill.tagger;

import com.gentoro.slotfill.exception.NotTrainedException;
import com.gentoro.slotfill.exception.StateException;
import com.gentoro.slotfill.exception.ValidationException;
import com.gentoro.slotfill.features.FeatureVectorizer;
import com.gentoro.slotfill.logging.LoggingService;
import com.gentoro.slotfill.model.Sequence;
import com.gentoro.slotfill.progress.NoOpProgressSink;
import com.gentoro.slotfill.progress.ProgressSink;
import com.gentoro.slotfill.toolkit.CrfBackend;
import com.gentoro.slotfill.toolkit.CrfTagger;
import com.gentoro.slotfill.toolkit.CrfTrainer;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * CRF sequence tagger over the attributes produced by {@link FeatureVectorizer}.
 *
 * <p>{@link #train} may be called once. After it returns the tagger is read-only and {@link #tag}
 * can be called from any thread.
 */
public class SequenceTagger implements SlotTagger, AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(SequenceTagger.class);

  public static final String MODEL_FILE = "crf-model.bin";
  public static final String STAGE = "crf";

  private final CrfBackend backend;
  private final CrfParams params;
  private final FeatureVectorizer vectorizer;
  private volatile CrfTagger tagger;

  public SequenceTagger(CrfBackend backend, CrfParams params, FeatureVectorizer vectorizer) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.params = Objects.requireNonNull(params, "params");
    this.vectorizer = Objects.requireNonNull(vectorizer, "vectorizer");
  }

  public void train(List<Sequence> sequences, Path workDir) {
    train(sequences, workDir, NoOpProgressSink.INSTANCE);
  }

  /**
   * Builds one training example per sequence, trains the CRF into {@code workDir/crf-model.bin}
   * and opens a tagger on the result.
   */
  public synchronized void train(List<Sequence> sequences, Path workDir, ProgressSink progress) {
    if (tagger != null) {
      throw new StateException("Sequence tagger is already trained");
    }
    if (sequences == null || sequences.isEmpty()) {
      throw new ValidationException("Cannot train the CRF tagger on an empty training set");
    }

    CrfTrainer trainer =
        backend.createTrainer(params.algorithm(), msg -> log.debug("crf: {}", msg.stripTrailing()));
    trainer.setParams(params.toTrainerParams());

    int appended = 0;
    for (Sequence sequence : sequences) {
      if (sequence.size() == 0) continue;
      trainer.append(vectorizer.vectorizeSequence(sequence), sequence.labels());
      progress.step(STAGE, ++appended, "appended sequence");
    }

    Path modelFile = workDir.resolve(MODEL_FILE);
    log.debug("Training CRF on {} sequences with {}", appended, params.toTrainerParams());
    trainer.train(modelFile);
    this.tagger = backend.openTagger(modelFile);
    log.info("CRF model trained on {} sequences: {}", appended, modelFile);
  }

  public boolean isTrained() {
    return tagger != null;
  }

  @Override
  public List<String> tag(Sequence sequence) {
    CrfTagger current = tagger;
    if (current == null) {
      throw new NotTrainedException();
    }
    if (sequence.size() == 0) return List.of();
    return current.tag(vectorizer.vectorizeSequence(sequence));
  }

  @Override
  public void close() {
    CrfTagger current = tagger;
    tagger = null;
    if (current != null) {
      current.close();
    }
  }
}
