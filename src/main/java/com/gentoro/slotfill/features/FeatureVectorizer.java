package com.gentoro.slotfill.features;

import com.gentoro.slotfill.cluster.WordClusters;
import com.gentoro.slotfill.model.Sequence;
import com.gentoro.slotfill.model.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns a token position into CRF attributes over the window {@code i-1, i, i+1}.
 *
 * <p>Neighbours carry a cluster feature, the centre token never does, so the tagger cannot key on
 * the clustered identity of the token it labels.
 */
public class FeatureVectorizer {
  public static final String PREVIOUS = "w[-1]";
  public static final String CURRENT = "w[0]";
  public static final String NEXT = "w[1]";
  public static final String BEGINNING_OF_SEQUENCE = "w[0]bos";
  public static final String END_OF_SEQUENCE = "w[0]eos";

  private final WordClusters clusters;

  public FeatureVectorizer(WordClusters clusters) {
    this.clusters = Objects.requireNonNull(clusters, "clusters");
  }

  /** Attributes of position {@code idx}: previous, current, then next segment. */
  public List<String> vectorize(List<Token> tokens, String intent, int idx) {
    if (idx < 0 || idx >= tokens.size()) {
      throw new IndexOutOfBoundsException(
          "Token index " + idx + " out of range for " + tokens.size() + " tokens");
    }
    List<String> features = new ArrayList<>();
    if (idx == 0) {
      features.add(BEGINNING_OF_SEQUENCE);
    } else {
      features.addAll(vectorizeToken(tokens.get(idx - 1), intent, PREVIOUS, true));
    }
    features.addAll(vectorizeToken(tokens.get(idx), intent, CURRENT, false));
    if (idx == tokens.size() - 1) {
      features.add(END_OF_SEQUENCE);
    } else {
      features.addAll(vectorizeToken(tokens.get(idx + 1), intent, NEXT, true));
    }
    return features;
  }

  /** Attributes of every position, in token order. */
  public List<List<String>> vectorizeSequence(Sequence sequence) {
    List<List<String>> out = new ArrayList<>(sequence.size());
    for (int i = 0; i < sequence.size(); i++) {
      out.add(vectorize(sequence.tokens(), sequence.intent(), i));
    }
    return out;
  }

  List<String> vectorizeToken(Token token, String intent, String prefix, boolean includeCluster) {
    String value = token.value();
    List<String> features = new ArrayList<>();
    features.add(prefix + "intent=" + intent);
    if (value.equals(value.toLowerCase(Locale.ROOT))) features.add(prefix + "low");
    if (value.equals(value.toUpperCase(Locale.ROOT))) features.add(prefix + "up");
    if (isTitle(value)) features.add(prefix + "title");
    if (includeCluster) {
      features.add(prefix + "cluster=" + clusters.clusterOf(value));
    }
    if (token.matchedEntities().isEmpty()) {
      features.add(prefix + "entity=none");
    } else {
      for (String entity : token.matchedEntities()) {
        features.add(prefix + "entity=" + entity);
      }
    }
    return features;
  }

  private static boolean isTitle(String value) {
    if (value.length() < 2) return false;
    char first = value.charAt(0);
    char second = value.charAt(1);
    return first == Character.toUpperCase(first) && second == Character.toLowerCase(second);
  }
}
