package com.gentoro.slotfill.toolkit.fasttext;

import com.gentoro.slotfill.embedding.EmbeddingParams;
import com.gentoro.slotfill.exception.TrainingException;
import com.gentoro.slotfill.logging.LoggingService;
import com.gentoro.slotfill.toolkit.EmbeddingBackend;
import com.gentoro.slotfill.toolkit.WordVectors;
import com.github.jfasttext.JFastText;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Unsupervised fastText training through the JFastText JNI binding. */
public class FastTextEmbeddingBackend implements EmbeddingBackend {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(FastTextEmbeddingBackend.class);

  @Override
  public WordVectors train(Path corpusFile, Path modelPrefix, EmbeddingParams params) {
    String[] args = arguments(corpusFile, modelPrefix, params);
    log.debug("fastText {}", String.join(" ", args));

    JFastText fastText = new JFastText();
    try {
      fastText.runCmd(args);
    } catch (RuntimeException e) {
      throw new TrainingException("fastText training failed on corpus " + corpusFile, e);
    }

    Path modelFile = modelPrefix.resolveSibling(modelPrefix.getFileName() + ".bin");
    if (!Files.isRegularFile(modelFile)) {
      throw new TrainingException(
          "fastText did not produce a model file",
          Map.of("corpus", corpusFile.toString(), "model", modelFile.toString()));
    }
    try {
      fastText.loadModel(modelFile.toString());
    } catch (RuntimeException e) {
      throw new TrainingException("Failed to load fastText model " + modelFile, e);
    }
    log.info("fastText model ready at {} (dim={})", modelFile, params.dim());
    return new FastTextWordVectors(fastText, params.dim());
  }

  static String[] arguments(Path corpusFile, Path modelPrefix, EmbeddingParams params) {
    return List.of(
            params.method(),
            "-input",
            corpusFile.toString(),
            "-output",
            modelPrefix.toString(),
            "-minCount",
            Integer.toString(params.minCount()),
            "-bucket",
            Integer.toString(params.bucket()),
            "-dim",
            Integer.toString(params.dim()),
            "-lr",
            Double.toString(params.learningRate()),
            "-wordNgrams",
            Integer.toString(params.wordNgrams()),
            "-minn",
            Integer.toString(params.minn()),
            "-maxn",
            Integer.toString(params.maxn()),
            "-epoch",
            Integer.toString(params.epoch()),
            "-verbose",
            "0")
        .toArray(new String[0]);
  }
}
