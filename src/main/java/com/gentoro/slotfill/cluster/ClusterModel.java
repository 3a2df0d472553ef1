package com.gentoro.slotfill.cluster;

import com.gentoro.slotfill.exception.TrainingException;
import com.gentoro.slotfill.exception.ValidationException;
import com.gentoro.slotfill.logging.LoggingService;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;

/** Partition of the embedding space into K k-means clusters, identified by centroid index. */
public final class ClusterModel {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ClusterModel.class);
  private static final EuclideanDistance DISTANCE = new EuclideanDistance();

  private final List<double[]> centroids;

  private ClusterModel(List<double[]> centroids) {
    this.centroids = centroids;
  }

  /**
   * Runs k-means++ over the distinct input vectors.
   *
   * @throws TrainingException when there are fewer distinct vectors than clusters, or when the
   *     clustering itself fails
   */
  public static ClusterModel fit(Collection<double[]> vectors, ClusterParams params) {
    Set<DoublePoint> distinct = new LinkedHashSet<>();
    for (double[] v : vectors) {
      distinct.add(new DoublePoint(v));
    }
    if (distinct.size() < params.count()) {
      throw new TrainingException(
          "Clustering needs at least %d distinct word vectors but only %d were found"
              .formatted(params.count(), distinct.size()),
          Map.of("distinctPoints", distinct.size(), "clusters", params.count()));
    }

    KMeansPlusPlusClusterer<DoublePoint> clusterer =
        new KMeansPlusPlusClusterer<>(
            params.count(), params.maxIterations(), DISTANCE, new Well19937c(params.seed()));
    List<CentroidCluster<DoublePoint>> clusters;
    try {
      clusters = clusterer.cluster(distinct);
    } catch (MathIllegalArgumentException | MathIllegalStateException e) {
      throw new TrainingException("k-means clustering failed", e);
    }
    List<double[]> centroids = clusters.stream().map(c -> c.getCenter().getPoint()).toList();
    log.debug("Fitted {} clusters over {} distinct vectors", centroids.size(), distinct.size());
    return new ClusterModel(centroids);
  }

  public int size() {
    return centroids.size();
  }

  /** Index of the centroid closest to {@code vector} (Euclidean distance, first wins on ties). */
  public int nearestCluster(double[] vector) {
    int best = -1;
    double bestDistance = Double.POSITIVE_INFINITY;
    for (int i = 0; i < centroids.size(); i++) {
      double[] centroid = centroids.get(i);
      if (centroid.length != vector.length) {
        throw new ValidationException(
            "Vector dimension %d does not match cluster dimension %d"
                .formatted(vector.length, centroid.length));
      }
      double d = DISTANCE.compute(centroid, vector);
      if (d < bestDistance) {
        bestDistance = d;
        best = i;
      }
    }
    return best;
  }
}
