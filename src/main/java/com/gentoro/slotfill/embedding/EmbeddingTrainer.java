package com.gentoro.slotfill.embedding;

import com.gentoro.slotfill.exception.ValidationException;
import com.gentoro.slotfill.logging.LoggingService;
import com.gentoro.slotfill.model.BIO;
import com.gentoro.slotfill.model.Sequence;
import com.gentoro.slotfill.model.Token;
import com.gentoro.slotfill.toolkit.EmbeddingBackend;
import com.gentoro.slotfill.toolkit.WordVectors;
import com.gentoro.slotfill.utility.FileUtility;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Learns word vectors from a canonicalized corpus in which every slot-tagged token is replaced by
 * its slot name, so that words seen in the same slot contexts end up close together.
 */
public class EmbeddingTrainer {
  private static final org.slf4j.Logger log = LoggingService.getLogger(EmbeddingTrainer.class);

  public static final String CORPUS_FILE = "embedding-corpus.txt";
  public static final String MODEL_PREFIX = "embedding-model";

  private final EmbeddingBackend backend;
  private final EmbeddingParams params;

  public EmbeddingTrainer(EmbeddingBackend backend, EmbeddingParams params) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.params = Objects.requireNonNull(params, "params");
  }

  /**
   * Writes the corpus to {@code workDir} and trains the backend on it. Backend failures propagate
   * as thrown.
   */
  public WordVectors train(List<Sequence> sequences, Path workDir) {
    if (sequences == null || sequences.isEmpty()) {
      throw new ValidationException("Cannot train word embeddings on an empty training set");
    }
    Path corpusFile = workDir.resolve(CORPUS_FILE);
    FileUtility.writeUtf8(corpusFile, corpus(sequences));
    log.debug("Wrote embedding corpus of {} sentences to {}", sequences.size(), corpusFile);
    return backend.train(corpusFile, workDir.resolve(MODEL_PREFIX), params);
  }

  /** One lowercased canonical sentence per line. */
  public static String corpus(List<Sequence> sequences) {
    return sequences.stream()
        .map(EmbeddingTrainer::canonicalSentence)
        .map(line -> line + "\n")
        .collect(Collectors.joining());
  }

  public static String canonicalSentence(Sequence sequence) {
    return sequence.tokens().stream()
        .map(EmbeddingTrainer::canonicalWord)
        .collect(Collectors.joining(" "));
  }

  private static String canonicalWord(Token token) {
    String word = token.tag() == BIO.OUT ? token.value() : token.slot();
    return word.toLowerCase(Locale.ROOT);
  }
}
