package com.gentoro.slotfill.toolkit;

/** Bundle of the external learning capabilities the extractor depends on. */
public interface MlToolkit {

  EmbeddingBackend embeddings();

  CrfBackend crf();
}
