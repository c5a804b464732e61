package com.motaz.pipeline.analysis.model;

import lombok.Value;

import java.util.List;

/**
 * Result of one segmentation call. {@code groupIds[i]} belongs to the i-th input sample.
 */
@Value
public class Segmentation {
    int[] groupIds;
    List<EventGroup> groups;

    public int groupCount() {
        return groups.size();
    }
}
