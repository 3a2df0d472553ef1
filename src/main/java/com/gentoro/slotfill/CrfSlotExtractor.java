package com.gentoro.slotfill;

import com.gentoro.slotfill.cluster.WordClusters;
import com.gentoro.slotfill.embedding.EmbeddingTrainer;
import com.gentoro.slotfill.exception.ExceptionUtil;
import com.gentoro.slotfill.exception.NotTrainedException;
import com.gentoro.slotfill.exception.StateException;
import com.gentoro.slotfill.exception.ValidationException;
import com.gentoro.slotfill.features.FeatureVectorizer;
import com.gentoro.slotfill.logging.LoggingService;
import com.gentoro.slotfill.model.Entity;
import com.gentoro.slotfill.model.IntentDefinition;
import com.gentoro.slotfill.model.Sequence;
import com.gentoro.slotfill.model.SlotCollection;
import com.gentoro.slotfill.progress.LoggingProgressSink;
import com.gentoro.slotfill.progress.ProgressSink;
import com.gentoro.slotfill.tagger.SequenceTagger;
import com.gentoro.slotfill.toolkit.MlToolkit;
import com.gentoro.slotfill.toolkit.MlToolkitFactory;
import com.gentoro.slotfill.utility.FileUtility;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.apache.commons.configuration2.Configuration;

/**
 * Slot extractor backed by word embeddings, k-means word clusters and a CRF tagger.
 *
 * <p>Training runs three stages in order: embeddings on the canonicalized corpus, clustering of
 * the corpus vocabulary, then CRF training. The extractor only becomes usable once all three have
 * succeeded; a failing stage leaves it untrained and the failure propagates unchanged. Model
 * artifacts live in a work directory scoped to this instance and removed by {@link #close()}.
 *
 * <p>{@link #extract} and {@link #tag} may be called concurrently once trained. {@link #train}
 * calls must not overlap; an overlapping call fails with a {@link StateException}.
 */
public class CrfSlotExtractor implements SlotExtractor, AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(CrfSlotExtractor.class);

  static final String WORK_DIR_PREFIX = "slot-extractor-";

  private final MlToolkit toolkit;
  private final ExtractorConfig config;
  private final ProgressSink progress;
  private final AtomicBoolean training = new AtomicBoolean(false);
  private volatile TrainingState state = TrainingState.UNTRAINED;
  private final Object lifecycle = new Object();
  private volatile boolean closed;

  public CrfSlotExtractor(MlToolkit toolkit, ExtractorConfig config) {
    this(
        toolkit,
        config,
        new LoggingProgressSink(log, config.progressMinIntervalMs(), config.progressMinDelta()));
  }

  public CrfSlotExtractor(MlToolkit toolkit, ExtractorConfig config, ProgressSink progress) {
    this.toolkit = Objects.requireNonNull(toolkit, "toolkit");
    this.config = Objects.requireNonNull(config, "config");
    this.progress = Objects.requireNonNull(progress, "progress");
  }

  /** Extractor configured from the {@code slots.*} and {@code logging.*} keys of {@code cfg}. */
  public static CrfSlotExtractor fromConfiguration(Configuration cfg) {
    LoggingService.applyConfiguration(cfg);
    ExtractorConfig config = ExtractorConfig.from(cfg);
    log.debug("Creating slot extractor with {}", config);
    return new CrfSlotExtractor(MlToolkitFactory.create(config), config);
  }

  /**
   * Extractor configured from a YAML location ({@code classpath:...} or a file path), see {@link
   * ConfigurationProvider}.
   */
  public static CrfSlotExtractor fromLocation(String location) {
    return fromConfiguration(new ConfigurationProvider(location).config());
  }

  @Override
  public void train(List<Sequence> trainingSet) {
    if (closed) {
      throw new StateException("Slot extractor is closed");
    }
    if (!training.compareAndSet(false, true)) {
      throw new StateException("Training already in progress for this extractor");
    }
    try {
      discard();
      if (trainingSet == null || trainingSet.isEmpty()) {
        throw new ValidationException("Training set is empty");
      }
      List<Sequence> sequences = List.copyOf(trainingSet);
      log.info("Training slot extractor on {} sequences", sequences.size());
      publish(runStages(sequences));
      log.info("Slot extractor trained");
    } finally {
      training.set(false);
    }
  }

  private TrainingState.Trained runStages(List<Sequence> sequences) {
    Path workDir = FileUtility.createWorkDirectory(config.workDir(), WORK_DIR_PREFIX);
    TrainingState reached = TrainingState.UNTRAINED;
    try {
      EmbeddingTrainer embeddingTrainer =
          new EmbeddingTrainer(toolkit.embeddings(), config.embedding());
      TrainingState.EmbeddingsReady embeddings =
          stage(
              "embeddings",
              "Training word embeddings",
              sequences.size(),
              () ->
                  TrainingState.UNTRAINED.withEmbeddings(
                      workDir, embeddingTrainer.train(sequences, workDir)));
      reached = embeddings;

      TrainingState.ClustersReady clusters =
          stage(
              "clusters",
              "Clustering word vectors",
              config.clusters().count(),
              () ->
                  embeddings.withClusters(
                      WordClusters.train(sequences, embeddings.vectors(), config.clusters())));
      reached = clusters;

      SequenceTagger tagger =
          new SequenceTagger(
              toolkit.crf(), config.crf(), new FeatureVectorizer(clusters.clusters()));
      TrainingState.Trained trained =
          stage(
              SequenceTagger.STAGE,
              "Training CRF tagger",
              sequences.size(),
              () -> {
                try {
                  tagger.train(sequences, workDir, progress);
                } catch (RuntimeException e) {
                  tagger.close();
                  throw e;
                }
                return clusters.withTagger(tagger);
              });
      reached = trained;
      return trained;
    } catch (RuntimeException e) {
      reached.close();
      FileUtility.deleteDir(workDir, true);
      throw e;
    }
  }

  private <T> T stage(String id, String label, long totalWork, Supplier<T> body) {
    progress.beginStage(id, label, totalWork);
    long started = System.currentTimeMillis();
    try {
      T result = body.get();
      progress.endStageOk(id, Map.of("elapsedMs", System.currentTimeMillis() - started));
      return result;
    } catch (RuntimeException e) {
      long elapsed = System.currentTimeMillis() - started;
      progress.endStageError(id, ExceptionUtil.summarize(e), Map.of("elapsedMs", elapsed));
      log.warn(
          "Training stage '{}' failed: {} at {}",
          id,
          ExceptionUtil.summarize(e),
          ExceptionUtil.formatCompactStackTrace(e, 5));
      throw e;
    }
  }

  @Override
  public SlotCollection extract(String text, IntentDefinition intent, List<Entity> entities) {
    return new SlotExtractionPipeline(trained().tagger()).extract(text, intent, entities);
  }

  /** Raw label sequence for an already tokenized sequence, e.g. for model validation. */
  public List<String> tag(Sequence sequence) {
    return trained().tagger().tag(sequence);
  }

  public boolean isTrained() {
    return state instanceof TrainingState.Trained;
  }

  /** Work directory of the trained model, empty while untrained. */
  public Optional<Path> workDirectory() {
    TrainingState current = state;
    return current instanceof TrainingState.Trained t ? Optional.of(t.workDir()) : Optional.empty();
  }

  public ExtractorConfig config() {
    return config;
  }

  /** Release the trained model and delete its files. Safe to call multiple times. */
  @Override
  public void close() {
    synchronized (lifecycle) {
      closed = true;
      discard();
    }
  }

  private TrainingState.Trained trained() {
    TrainingState current = state;
    if (current instanceof TrainingState.Trained t) {
      return t;
    }
    throw new NotTrainedException();
  }

  /** Installs a freshly trained model unless the extractor was closed while it was training. */
  private void publish(TrainingState.Trained trained) {
    synchronized (lifecycle) {
      if (!closed) {
        this.state = trained;
        return;
      }
    }
    trained.close();
    throw new StateException("Slot extractor was closed while training");
  }

  private void discard() {
    TrainingState previous;
    synchronized (lifecycle) {
      previous = state;
      state = TrainingState.UNTRAINED;
    }
    previous.close();
  }
}
