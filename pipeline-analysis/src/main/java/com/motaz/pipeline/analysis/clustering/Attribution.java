package com.motaz.pipeline.analysis.clustering;

import lombok.Builder;
import lombok.Value;

import java.util.OptionalInt;

/**
 * Which cluster holds the genuine faults and how many groups fall outside it.
 */
@Value
@Builder
public class Attribution {

    public static final int NO_FAULT_CLUSTER = -1;

    int totalGroups;
    int faultClusterId;
    int groupsInFaultCluster;
    int[] leakGroupsPerCluster;
    double falsePositiveReduction;
    /**
     * True when no group is leak-dominant, so the reduction of 100 carries no information.
     */
    boolean degenerate;

    public Attribution(int totalGroups, int faultClusterId, int groupsInFaultCluster, int[] leakGroupsPerCluster,
                       double falsePositiveReduction, boolean degenerate) {
        this.totalGroups = totalGroups;
        this.faultClusterId = faultClusterId;
        this.groupsInFaultCluster = groupsInFaultCluster;
        this.leakGroupsPerCluster = leakGroupsPerCluster.clone();
        this.falsePositiveReduction = falsePositiveReduction;
        this.degenerate = degenerate;
    }

    public int[] getLeakGroupsPerCluster() {
        return leakGroupsPerCluster.clone();
    }

    public OptionalInt faultCluster() {
        return faultClusterId == NO_FAULT_CLUSTER ? OptionalInt.empty() : OptionalInt.of(faultClusterId);
    }
}
