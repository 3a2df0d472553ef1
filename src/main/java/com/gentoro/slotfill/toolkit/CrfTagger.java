package com.gentoro.slotfill.toolkit;

import java.util.List;

/** Read-only tagger over a trained CRF model. Implementations must be safe for concurrent use. */
public interface CrfTagger extends AutoCloseable {

  /** Most likely label per position (Viterbi decoding). */
  List<String> tag(List<List<String>> features);

  @Override
  void close();
}
