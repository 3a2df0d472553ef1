package com.gentoro.slotfill;

import com.gentoro.slotfill.assembly.SlotAssembler;
import com.gentoro.slotfill.model.Entity;
import com.gentoro.slotfill.model.IntentDefinition;
import com.gentoro.slotfill.model.Sequence;
import com.gentoro.slotfill.model.SlotCollection;
import com.gentoro.slotfill.preprocessing.SequenceGenerator;
import com.gentoro.slotfill.tagger.SlotTagger;
import java.util.List;
import java.util.Objects;

/** Inference path: tokenize, tag, assemble. Stateless apart from the tagger it wraps. */
public final class SlotExtractionPipeline {
  private final SlotTagger tagger;

  public SlotExtractionPipeline(SlotTagger tagger) {
    this.tagger = Objects.requireNonNull(tagger, "tagger");
  }

  public SlotCollection extract(String text, IntentDefinition intent, List<Entity> entities) {
    Objects.requireNonNull(intent, "intent");
    Sequence sequence = SequenceGenerator.forPrediction(text, intent.name(), entities);
    if (sequence.size() == 0) return SlotCollection.empty();
    List<String> tags = tagger.tag(sequence);
    return SlotAssembler.assemble(sequence.tokens(), tags, intent, entities);
  }
}
