package com.motaz.pipeline.analysis.clustering;

import java.util.OptionalDouble;

/**
 * Mean silhouette coefficient with Euclidean distance. Rows alone in their cluster score 0.
 */
public final class SilhouetteScore {

    private SilhouetteScore() {
    }

    /**
     * Empty unless there are at least 2 clusters and fewer clusters than rows.
     */
    public static OptionalDouble of(double[][] x, int[] labels, int clusters) {
        int n = x.length;
        if (clusters < 2 || clusters >= n) {
            return OptionalDouble.empty();
        }
        int[] counts = new int[clusters];
        for (int label : labels) {
            counts[label]++;
        }
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            if (counts[labels[i]] <= 1) {
                continue;
            }
            double[] sums = new double[clusters];
            for (int j = 0; j < n; j++) {
                if (j != i) {
                    sums[labels[j]] += Distances.euclidean(x[i], x[j]);
                }
            }
            double a = sums[labels[i]] / (counts[labels[i]] - 1);
            double b = Double.POSITIVE_INFINITY;
            for (int c = 0; c < clusters; c++) {
                if (c != labels[i] && counts[c] > 0) {
                    b = Math.min(b, sums[c] / counts[c]);
                }
            }
            double spread = Math.max(a, b);
            total += spread == 0.0 ? 0.0 : (b - a) / spread;
        }
        return OptionalDouble.of(total / n);
    }

    public static OptionalDouble of(ClusteringResult result) {
        return of(result.getStandardized(), result.getLabels(), result.getClusters());
    }
}
