package com.motaz.pipeline.analysis.clustering;

/**
 * Partitions event feature rows. Implementations must be deterministic: the same rows give the
 * same labels.
 */
public interface EventClusterer {

    ClusteringResult fit(double[][] features);
}
