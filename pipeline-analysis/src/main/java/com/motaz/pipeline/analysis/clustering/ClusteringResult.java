package com.motaz.pipeline.analysis.clustering;

import com.motaz.pipeline.analysis.config.LinkageType;
import com.motaz.pipeline.analysis.feature.FeatureScaler;
import lombok.Value;

import java.io.Serializable;

/**
 * Partition of the input rows. {@code labels[i]} is the cluster of input row i.
 */
@Value
public class ClusteringResult implements Serializable {

    private static final long serialVersionUID = 1L;

    int clusters;
    LinkageType linkage;
    int[] labels;
    FeatureScaler scaler;
    double[][] standardized;
    double[][] centroids;

    public ClusteringResult(int clusters, LinkageType linkage, int[] labels, FeatureScaler scaler,
                            double[][] standardized, double[][] centroids) {
        this.clusters = clusters;
        this.linkage = linkage;
        this.labels = labels.clone();
        this.scaler = scaler;
        this.standardized = copy(standardized);
        this.centroids = copy(centroids);
    }

    public int[] getLabels() {
        return labels.clone();
    }

    public double[][] getStandardized() {
        return copy(standardized);
    }

    public double[][] getCentroids() {
        return copy(centroids);
    }

    public int size(int label) {
        int size = 0;
        for (int l : labels) {
            if (l == label) {
                size++;
            }
        }
        return size;
    }

    /**
     * Assigns an unseen raw feature vector to the cluster with the closest centroid; ties go to the lower id.
     */
    public int nearestCluster(double[] features) {
        double[] x = scaler.transform(features);
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.length; c++) {
            double distance = Distances.squaredEuclidean(x, centroids[c]);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = c;
            }
        }
        return best;
    }

    private static double[][] copy(double[][] matrix) {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }
}
