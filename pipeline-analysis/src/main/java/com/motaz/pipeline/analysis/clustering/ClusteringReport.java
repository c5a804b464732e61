package com.motaz.pipeline.analysis.clustering;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ClusteringReport {
    int numClusters;
    Double silhouetteScore;
    double falsePositiveReduction;
    Integer faultClusterId;
    int totalEventGroups;
    int degenerateGroups;
    int featureDimension;
    int[] leakGroupsPerCluster;
    boolean noLeakGroups;
}
