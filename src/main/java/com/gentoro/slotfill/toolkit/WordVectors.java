package com.gentoro.slotfill.toolkit;

/**
 * Trained word-vector lookup. Words are looked up lowercased; implementations may return
 * subword-based vectors for words never seen during training.
 */
public interface WordVectors extends AutoCloseable {

  /** Vector of {@code word}, always {@link #dimension()} long. */
  double[] vectorOf(String word);

  int dimension();

  /** Release native handles. Idempotent. */
  @Override
  void close();
}
