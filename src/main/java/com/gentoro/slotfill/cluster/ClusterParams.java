package com.gentoro.slotfill.cluster;

import com.gentoro.slotfill.exception.ConfigException;

/**
 * k-means settings.
 *
 * @param count number of clusters (K)
 * @param maxIterations iteration bound for one k-means run, negative for no bound
 * @param seed random seed for centroid seeding
 */
public record ClusterParams(int count, int maxIterations, long seed) {
  public static final ClusterParams DEFAULTS = new ClusterParams(15, 300, 42L);

  public ClusterParams {
    if (count < 1) {
      throw new ConfigException("Cluster count must be positive, got " + count);
    }
  }
}
