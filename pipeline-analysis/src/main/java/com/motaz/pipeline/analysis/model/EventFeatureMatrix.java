package com.motaz.pipeline.analysis.model;

import lombok.Value;

import java.util.List;

/**
 * Feature rows for the non-degenerate event groups. {@code groups.get(i)} and {@code features.get(i)}
 * describe the same event, and row i of {@link #toMatrix()} is that event's vector.
 */
@Value
public class EventFeatureMatrix {
    List<EventGroup> groups;
    List<EventFeatures> features;
    int degenerateGroups;

    public int rows() {
        return groups.size();
    }

    public double[][] toMatrix() {
        return features.stream().map(EventFeatures::toVector).toArray(double[][]::new);
    }
}
