package com.gentoro.slotfill.embedding;

import com.gentoro.slotfill.exception.ConfigException;

/**
 * Hyperparameters handed to the word-embedding backend.
 *
 * @param method {@code skipgram} or {@code cbow}
 * @param minCount minimal number of word occurrences
 * @param bucket number of hash buckets for character n-grams
 * @param dim vector dimension
 * @param learningRate initial learning rate
 * @param wordNgrams max length of word n-grams
 * @param minn min character n-gram length
 * @param maxn max character n-gram length
 * @param epoch number of training epochs
 */
public record EmbeddingParams(
    String method,
    int minCount,
    int bucket,
    int dim,
    double learningRate,
    int wordNgrams,
    int minn,
    int maxn,
    int epoch) {

  public static final EmbeddingParams DEFAULTS =
      new EmbeddingParams("skipgram", 2, 25000, 15, 0.5, 3, 2, 6, 50);

  public EmbeddingParams {
    if (!"skipgram".equals(method) && !"cbow".equals(method)) {
      throw new ConfigException("Unsupported embedding method: " + method);
    }
    if (dim <= 0 || epoch <= 0 || minCount < 1 || bucket < 0 || learningRate <= 0) {
      throw new ConfigException(
          "Invalid embedding parameters: dim=%d, epoch=%d, minCount=%d, bucket=%d, lr=%s"
              .formatted(dim, epoch, minCount, bucket, learningRate));
    }
    if (minn < 0 || maxn < minn) {
      throw new ConfigException("Invalid character n-gram range [%d, %d]".formatted(minn, maxn));
    }
  }
}
