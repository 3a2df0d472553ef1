package com.gentoro.slotfill.tagger;

import com.gentoro.slotfill.model.Sequence;
import java.util.List;

/** Labels every token of a sequence with a composite BIO label ({@code o}, {@code B-artist}). */
@FunctionalInterface
public interface SlotTagger {

  /** One label per token, in token order. Must not mutate any model state. */
  List<String> tag(Sequence sequence);
}
