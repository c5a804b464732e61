package com.motaz.pipeline.analysis.clustering;

import com.motaz.pipeline.analysis.config.LinkageType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Picks the cluster count with the best silhouette in a range. Equal scores keep the smaller count.
 */
@Slf4j
@RequiredArgsConstructor
public class ClusterCountOptimizer {

    private final LinkageType linkage;
    private final int minClusters;
    private final int maxClusters;

    public OptionalInt optimize(double[][] features) {
        int upper = Math.min(maxClusters, features.length - 1);
        int bestK = -1;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int k = Math.max(2, minClusters); k <= upper; k++) {
            ClusteringResult result = new AgglomerativeClusterer(k, linkage).fit(features);
            OptionalDouble score = SilhouetteScore.of(result);
            log.debug("k={} silhouette={}", k, score);
            if (score.isPresent() && score.getAsDouble() > bestScore) {
                bestScore = score.getAsDouble();
                bestK = k;
            }
        }
        if (bestK < 0) {
            log.warn("No cluster count in [{}, {}] is valid for {} rows", minClusters, maxClusters, features.length);
            return OptionalInt.empty();
        }
        log.info("Best cluster count {} with silhouette {}", bestK, bestScore);
        return OptionalInt.of(bestK);
    }
}
