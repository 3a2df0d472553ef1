package com.gentoro.slotfill.toolkit;

import java.util.Objects;

/** Plain pairing of an embedding backend and a CRF backend. */
public record DefaultMlToolkit(EmbeddingBackend embeddings, CrfBackend crf) implements MlToolkit {
  public DefaultMlToolkit {
    Objects.requireNonNull(embeddings, "embeddings");
    Objects.requireNonNull(crf, "crf");
  }
}
