package com.gentoro.slotfill.toolkit.fasttext;

import com.gentoro.slotfill.exception.StateException;
import com.gentoro.slotfill.toolkit.WordVectors;
import com.github.jfasttext.JFastText;
import java.util.List;
import java.util.Locale;

/** Word vectors served by a loaded fastText model. Calls into the native model are serialized. */
final class FastTextWordVectors implements WordVectors {
  private final JFastText model;
  private final int dimension;
  private boolean closed;

  FastTextWordVectors(JFastText model, int dimension) {
    this.model = model;
    this.dimension = dimension;
  }

  @Override
  public synchronized double[] vectorOf(String word) {
    if (closed) {
      throw new StateException("fastText model already closed");
    }
    List<Float> raw = model.getVector(word.toLowerCase(Locale.ROOT));
    double[] vector = new double[dimension];
    for (int i = 0; i < Math.min(dimension, raw.size()); i++) {
      vector[i] = raw.get(i);
    }
    return vector;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public synchronized void close() {
    if (!closed) {
      closed = true;
      model.unloadModel();
    }
  }
}
