package com.gentoro.slotfill.toolkit.crfsuite;

import com.gentoro.slotfill.exception.TrainingException;
import com.gentoro.slotfill.logging.LoggingService;
import com.gentoro.slotfill.toolkit.CrfBackend;
import com.gentoro.slotfill.toolkit.CrfTagger;
import com.gentoro.slotfill.toolkit.CrfTrainer;
import com.github.jcrfsuite.util.CrfSuiteLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;
import third_party.org.chokkan.crfsuite.Attribute;
import third_party.org.chokkan.crfsuite.Item;
import third_party.org.chokkan.crfsuite.ItemSequence;
import third_party.org.chokkan.crfsuite.Tagger;

/** First-order linear-chain CRF through the jcrfsuite binding of CRFsuite. */
public class CrfSuiteBackend implements CrfBackend {
  private static final org.slf4j.Logger log = LoggingService.getLogger(CrfSuiteBackend.class);

  static final String GRAPHICAL_MODEL = "crf1d";

  private static volatile boolean nativeLoaded;

  @Override
  public CrfTrainer createTrainer(String algorithm, Consumer<String> messageSink) {
    ensureNativeLoaded();
    return new CrfSuiteTrainer(algorithm, messageSink);
  }

  @Override
  public CrfTagger openTagger(Path modelFile) {
    ensureNativeLoaded();
    if (!Files.isRegularFile(modelFile)) {
      throw new TrainingException("CRF model file does not exist: " + modelFile);
    }
    Tagger tagger = new Tagger();
    if (!tagger.open(modelFile.toString())) {
      throw new TrainingException("CRFsuite could not open model " + modelFile);
    }
    log.debug("Opened CRF model {}", modelFile);
    return new CrfSuiteTagger(tagger);
  }

  /** One item per position, every feature string becoming an attribute of weight 1. */
  static ItemSequence toItemSequence(List<List<String>> features) {
    ItemSequence xseq = new ItemSequence();
    for (List<String> position : features) {
      Item item = new Item();
      for (String feature : position) {
        item.add(new Attribute(feature, 1.0));
      }
      xseq.add(item);
    }
    return xseq;
  }

  private static void ensureNativeLoaded() {
    if (nativeLoaded) return;
    synchronized (CrfSuiteBackend.class) {
      if (nativeLoaded) return;
      try {
        CrfSuiteLoader.load();
        nativeLoaded = true;
      } catch (Exception e) {
        throw new TrainingException("Failed to load the CRFsuite native library", e);
      }
    }
  }
}
