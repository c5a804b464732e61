package com.motaz.pipeline.analysis.clustering;

import com.motaz.pipeline.analysis.config.LinkageType;
import com.motaz.pipeline.analysis.exception.ConfigurationException;
import com.motaz.pipeline.analysis.feature.FeatureScaler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Bottom-up clustering on standardized rows with Lance-Williams distance updates.
 * <p>
 * Each active cluster lives in the slot of its lowest original row index. Pairs are scanned in
 * ascending (slot, slot) order and only a strictly lower cost replaces the current best, so equal
 * costs resolve to the pair with the lowest original indices. Final labels are numbered in order
 * of first appearance over the input rows.
 */
@Slf4j
@Getter
public class AgglomerativeClusterer implements EventClusterer {

    private final int clusters;
    private final LinkageType linkage;

    public AgglomerativeClusterer(int clusters, LinkageType linkage) {
        if (clusters < 1) {
            throw new ConfigurationException("cluster count must be positive, got " + clusters);
        }
        if (linkage == null) {
            throw new ConfigurationException("linkage must be set");
        }
        this.clusters = clusters;
        this.linkage = linkage;
    }

    @Override
    public ClusteringResult fit(double[][] features) {
        int n = features.length;
        if (clusters > n) {
            throw new ConfigurationException("Cannot form " + clusters + " clusters from " + n + " event groups");
        }
        FeatureScaler scaler = FeatureScaler.fit(features);
        double[][] x = scaler.transform(features);

        double[][] cost = initialCosts(x);
        boolean[] active = new boolean[n];
        int[] size = new int[n];
        int[] slotOf = new int[n];
        for (int i = 0; i < n; i++) {
            active[i] = true;
            size[i] = 1;
            slotOf[i] = i;
        }

        for (int remaining = n; remaining > clusters; remaining--) {
            int first = -1;
            int second = -1;
            double best = Double.POSITIVE_INFINITY;
            for (int i = 0; i < n; i++) {
                if (!active[i]) {
                    continue;
                }
                for (int j = i + 1; j < n; j++) {
                    if (active[j] && (first < 0 || cost[i][j] < best)) {
                        best = cost[i][j];
                        first = i;
                        second = j;
                    }
                }
            }
            merge(cost, active, size, first, second);
            for (int row = 0; row < n; row++) {
                if (slotOf[row] == second) {
                    slotOf[row] = first;
                }
            }
            log.trace("Merged cluster {} into {} at cost {}", second, first, best);
        }

        int[] labels = number(slotOf);
        double[][] centroids = centroids(x, labels, clusters);
        log.debug("Agglomerated {} rows into {} clusters with {} linkage", n, clusters, linkage.label());
        return new ClusteringResult(clusters, linkage, labels, scaler, x, centroids);
    }

    private double[][] initialCosts(double[][] x) {
        int n = x.length;
        double[][] cost = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                // ward works on squared distances, the others on plain distances
                double d = linkage == LinkageType.WARD
                        ? Distances.squaredEuclidean(x[i], x[j])
                        : Distances.euclidean(x[i], x[j]);
                cost[i][j] = d;
                cost[j][i] = d;
            }
        }
        return cost;
    }

    private void merge(double[][] cost, boolean[] active, int[] size, int first, int second) {
        int n = active.length;
        double between = cost[first][second];
        int ni = size[first];
        int nj = size[second];
        for (int k = 0; k < n; k++) {
            if (!active[k] || k == first || k == second) {
                continue;
            }
            int nk = size[k];
            double dik = cost[first][k];
            double djk = cost[second][k];
            double updated = switch (linkage) {
                case WARD -> ((ni + nk) * dik + (nj + nk) * djk - nk * between) / (ni + nj + nk);
                case COMPLETE -> Math.max(dik, djk);
                case SINGLE -> Math.min(dik, djk);
                case AVERAGE -> (ni * dik + nj * djk) / (ni + nj);
            };
            cost[first][k] = updated;
            cost[k][first] = updated;
        }
        size[first] = ni + nj;
        active[second] = false;
    }

    private static int[] number(int[] slotOf) {
        int n = slotOf.length;
        int[] labelOfSlot = new int[n];
        Arrays.fill(labelOfSlot, -1);
        int[] labels = new int[n];
        int next = 0;
        for (int row = 0; row < n; row++) {
            int slot = slotOf[row];
            if (labelOfSlot[slot] < 0) {
                labelOfSlot[slot] = next++;
            }
            labels[row] = labelOfSlot[slot];
        }
        return labels;
    }

    static double[][] centroids(double[][] x, int[] labels, int k) {
        int d = x.length == 0 ? 0 : x[0].length;
        double[][] centroids = new double[k][d];
        int[] counts = new int[k];
        for (int i = 0; i < x.length; i++) {
            counts[labels[i]]++;
            for (int j = 0; j < d; j++) {
                centroids[labels[i]][j] += x[i][j];
            }
        }
        for (int c = 0; c < k; c++) {
            for (int j = 0; j < d; j++) {
                centroids[c][j] /= Math.max(counts[c], 1);
            }
        }
        return centroids;
    }
}
