package com.motaz.pipeline.analysis.clustering;

import com.motaz.pipeline.analysis.exception.NoAnomaliesException;
import com.motaz.pipeline.analysis.model.AnomalyType;
import com.motaz.pipeline.analysis.model.EventFeatureMatrix;
import com.motaz.pipeline.analysis.model.EventGroup;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Names the cluster with the most leak-dominant groups as the fault cluster and measures how many
 * groups a fault-cluster-only alert policy would suppress.
 */
@Slf4j
public class ClusterAttributor {

    /**
     * @param labels        cluster of each group, position-aligned with {@code dominantTypes}
     * @param dominantTypes ground-truth type of each group
     * @param clusters      size of the label space
     */
    public Attribution attribute(int[] labels, List<AnomalyType> dominantTypes, int clusters) {
        if (labels.length != dominantTypes.size()) {
            throw new IllegalArgumentException("Got " + labels.length + " labels for " + dominantTypes.size() + " groups");
        }
        int total = labels.length;
        if (total == 0) {
            throw new NoAnomaliesException("No event groups to attribute");
        }
        int[] leakCounts = new int[clusters];
        for (int i = 0; i < total; i++) {
            if (dominantTypes.get(i) == AnomalyType.LEAK) {
                leakCounts[labels[i]]++;
            }
        }
        int fault = 0;
        for (int c = 1; c < clusters; c++) {
            if (leakCounts[c] > leakCounts[fault]) {
                fault = c;
            }
        }
        if (leakCounts[fault] == 0) {
            log.warn("None of the {} event groups is leak-dominant, no fault cluster", total);
            return Attribution.builder()
                    .totalGroups(total)
                    .faultClusterId(Attribution.NO_FAULT_CLUSTER)
                    .groupsInFaultCluster(0)
                    .leakGroupsPerCluster(leakCounts)
                    .falsePositiveReduction(100.0)
                    .degenerate(true)
                    .build();
        }
        int inFault = 0;
        for (int label : labels) {
            if (label == fault) {
                inFault++;
            }
        }
        double reduction = (double) (total - inFault) / total * 100.0;
        log.info("Fault cluster {} holds {} of {} groups, leak groups per cluster {}, false positive reduction {}%",
                fault, inFault, total, Arrays.toString(leakCounts), reduction);
        return Attribution.builder()
                .totalGroups(total)
                .faultClusterId(fault)
                .groupsInFaultCluster(inFault)
                .leakGroupsPerCluster(leakCounts)
                .falsePositiveReduction(reduction)
                .degenerate(false)
                .build();
    }

    public Attribution attribute(ClusteringResult result, EventFeatureMatrix matrix) {
        List<AnomalyType> types = matrix.getGroups().stream()
                .map(EventGroup::dominantType)
                .collect(Collectors.toList());
        return attribute(result.getLabels(), types, result.getClusters());
    }
}
