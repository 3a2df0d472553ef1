package com.gentoro.slotfill.toolkit.crfsuite;

import com.gentoro.slotfill.exception.InferenceException;
import com.gentoro.slotfill.exception.StateException;
import com.gentoro.slotfill.toolkit.CrfTagger;
import java.util.ArrayList;
import java.util.List;
import third_party.org.chokkan.crfsuite.StringList;
import third_party.org.chokkan.crfsuite.Tagger;

/** The native tagger keeps per-call state, so calls are serialized on this instance. */
final class CrfSuiteTagger implements CrfTagger {
  private final Tagger tagger;
  private boolean closed;

  CrfSuiteTagger(Tagger tagger) {
    this.tagger = tagger;
  }

  @Override
  public synchronized List<String> tag(List<List<String>> features) {
    if (closed) {
      throw new StateException("CRF tagger already closed");
    }
    if (features.isEmpty()) return List.of();
    StringList raw;
    try {
      raw = tagger.tag(CrfSuiteBackend.toItemSequence(features));
    } catch (RuntimeException e) {
      throw new InferenceException("CRFsuite tagging failed", e);
    }
    List<String> labels = new ArrayList<>();
    for (int i = 0; i < raw.size(); i++) {
      labels.add(raw.get(i));
    }
    return labels;
  }

  @Override
  public synchronized void close() {
    if (!closed) {
      closed = true;
      tagger.close();
    }
  }
}
