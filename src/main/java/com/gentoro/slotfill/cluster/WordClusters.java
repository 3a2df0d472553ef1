package com.gentoro.slotfill.cluster;

import com.gentoro.slotfill.logging.LoggingService;
import com.gentoro.slotfill.model.Sequence;
import com.gentoro.slotfill.model.Token;
import com.gentoro.slotfill.toolkit.WordVectors;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Cluster id per token value. Ids of the training vocabulary are computed once at training time;
 * other words are looked up through the word vectors on every call. Safe for concurrent use.
 */
public final class WordClusters {
  private static final org.slf4j.Logger log = LoggingService.getLogger(WordClusters.class);

  private final WordVectors vectors;
  private final ClusterModel model;
  private final Map<String, Integer> vocabulary;

  public WordClusters(WordVectors vectors, ClusterModel model) {
    this(vectors, model, Map.of());
  }

  private WordClusters(WordVectors vectors, ClusterModel model, Map<String, Integer> vocabulary) {
    this.vectors = Objects.requireNonNull(vectors, "vectors");
    this.model = Objects.requireNonNull(model, "model");
    this.vocabulary = Map.copyOf(vocabulary);
  }

  /** Clusters the vectors of every distinct token value in {@code sequences}. */
  public static WordClusters train(
      List<Sequence> sequences, WordVectors vectors, ClusterParams params) {
    Map<String, double[]> byWord = new LinkedHashMap<>();
    for (Sequence sequence : sequences) {
      for (Token token : sequence.tokens()) {
        byWord.computeIfAbsent(key(token.value()), vectors::vectorOf);
      }
    }
    log.debug("Collected vectors for {} distinct token values", byWord.size());
    ClusterModel model = ClusterModel.fit(byWord.values(), params);
    Map<String, Integer> vocabulary = new HashMap<>();
    byWord.forEach((word, vector) -> vocabulary.put(word, model.nearestCluster(vector)));
    return new WordClusters(vectors, model, vocabulary);
  }

  public int clusterOf(String word) {
    String key = key(word);
    Integer known = vocabulary.get(key);
    if (known != null) return known;
    return model.nearestCluster(vectors.vectorOf(key));
  }

  /** Number of words whose cluster id was fixed at training time. */
  public int vocabularySize() {
    return vocabulary.size();
  }

  public ClusterModel model() {
    return model;
  }

  private static String key(String word) {
    return word.toLowerCase(Locale.ROOT);
  }
}
