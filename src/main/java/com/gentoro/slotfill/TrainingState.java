package com.gentoro.slotfill;

import com.gentoro.slotfill.cluster.WordClusters;
import com.gentoro.slotfill.tagger.SequenceTagger;
import com.gentoro.slotfill.toolkit.WordVectors;
import com.gentoro.slotfill.utility.FileUtility;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Training progress of an extractor: {@code Untrained -> EmbeddingsReady -> ClustersReady ->
 * Trained}. Each state holds exactly the artifacts produced so far, so a state can only be built
 * from its predecessor.
 */
interface TrainingState extends AutoCloseable {

  Untrained UNTRAINED = new Untrained();

  /** Release model handles and delete the work directory. */
  @Override
  void close();

  record Untrained() implements TrainingState {
    EmbeddingsReady withEmbeddings(Path workDir, WordVectors vectors) {
      return new EmbeddingsReady(workDir, vectors);
    }

    @Override
    public void close() {}
  }

  record EmbeddingsReady(Path workDir, WordVectors vectors) implements TrainingState {
    public EmbeddingsReady {
      Objects.requireNonNull(workDir, "workDir");
      Objects.requireNonNull(vectors, "vectors");
    }

    ClustersReady withClusters(WordClusters clusters) {
      return new ClustersReady(workDir, vectors, clusters);
    }

    @Override
    public void close() {
      try {
        vectors.close();
      } finally {
        FileUtility.deleteDir(workDir, true);
      }
    }
  }

  record ClustersReady(Path workDir, WordVectors vectors, WordClusters clusters)
      implements TrainingState {
    public ClustersReady {
      Objects.requireNonNull(clusters, "clusters");
    }

    Trained withTagger(SequenceTagger tagger) {
      return new Trained(workDir, vectors, clusters, tagger);
    }

    @Override
    public void close() {
      new EmbeddingsReady(workDir, vectors).close();
    }
  }

  record Trained(Path workDir, WordVectors vectors, WordClusters clusters, SequenceTagger tagger)
      implements TrainingState {
    public Trained {
      Objects.requireNonNull(tagger, "tagger");
      if (!tagger.isTrained()) {
        throw new IllegalArgumentException("Sequence tagger must be trained");
      }
    }

    @Override
    public void close() {
      try {
        tagger.close();
      } finally {
        new EmbeddingsReady(workDir, vectors).close();
      }
    }
  }
}
