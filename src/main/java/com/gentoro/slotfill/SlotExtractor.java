package com.gentoro.slotfill;

import com.gentoro.slotfill.model.Entity;
import com.gentoro.slotfill.model.IntentDefinition;
import com.gentoro.slotfill.model.Sequence;
import com.gentoro.slotfill.model.SlotCollection;
import java.util.List;

/** Trainable extractor of named slots from free-text utterances. */
public interface SlotExtractor {

  /** Train on annotated sequences. Replaces any previously trained model. */
  void train(List<Sequence> trainingSet);

  /**
   * Extract the slots of {@code text} for the given intent.
   *
   * @param entities entities recognized over {@code text} by the entity engine
   * @throws com.gentoro.slotfill.exception.NotTrainedException when no model is trained
   */
  SlotCollection extract(String text, IntentDefinition intent, List<Entity> entities);
}
