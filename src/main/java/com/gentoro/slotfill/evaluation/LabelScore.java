package com.gentoro.slotfill.evaluation;

/**
 * Token-level scores of one label.
 *
 * @param truePositives tokens predicted with the label whose gold label matches
 * @param predicted tokens predicted with the label
 * @param support tokens whose gold label is this label
 */
public record LabelScore(int truePositives, int predicted, int support) {

  public double precision() {
    return predicted == 0 ? 0.0 : (double) truePositives / predicted;
  }

  public double recall() {
    return support == 0 ? 0.0 : (double) truePositives / support;
  }

  public double f1() {
    double p = precision();
    double r = recall();
    return p + r == 0 ? 0.0 : 2 * p * r / (p + r);
  }
}
