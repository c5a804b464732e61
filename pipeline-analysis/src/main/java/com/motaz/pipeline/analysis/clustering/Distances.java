package com.motaz.pipeline.analysis.clustering;

final class Distances {

    private Distances() {
    }

    static double squaredEuclidean(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }

    static double euclidean(double[] a, double[] b) {
        return Math.sqrt(squaredEuclidean(a, b));
    }
}
