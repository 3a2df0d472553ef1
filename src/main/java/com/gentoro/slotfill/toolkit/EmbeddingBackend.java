package com.gentoro.slotfill.toolkit;

import com.gentoro.slotfill.embedding.EmbeddingParams;
import java.nio.file.Path;

/** External capability that learns word vectors from a plain-text corpus, one sentence per line. */
public interface EmbeddingBackend {

  /**
   * Trains a model on {@code corpusFile} and returns a lookup over it.
   *
   * @param corpusFile UTF-8 corpus, whitespace separated tokens
   * @param modelPrefix path prefix of the model artifact; the backend picks the extension
   * @param params training hyperparameters
   */
  WordVectors train(Path corpusFile, Path modelPrefix, EmbeddingParams params);
}
