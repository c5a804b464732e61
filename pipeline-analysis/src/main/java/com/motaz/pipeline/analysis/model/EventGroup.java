package com.motaz.pipeline.analysis.model;

import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A run of anomalous samples without a gap above the segmentation threshold.
 * The id is only meaningful inside the segmentation call that produced it.
 */
@Value
public class EventGroup {
    int id;
    List<Sample> samples;

    public int size() {
        return samples.size();
    }

    public String assetId() {
        return samples.isEmpty() ? null : samples.get(0).getAssetId();
    }

    /**
     * Majority vote over the sample types; ties resolve to the type declared first.
     */
    public AnomalyType dominantType() {
        Map<AnomalyType, Integer> votes = new EnumMap<>(AnomalyType.class);
        for (Sample sample : samples) {
            votes.merge(sample.getAnomalyType(), 1, Integer::sum);
        }
        AnomalyType dominant = AnomalyType.NORMAL;
        int best = -1;
        for (AnomalyType type : AnomalyType.values()) {
            int count = votes.getOrDefault(type, 0);
            if (count > best) {
                best = count;
                dominant = type;
            }
        }
        return dominant;
    }

    public double[] primaryValues() {
        return samples.stream().mapToDouble(Sample::getPrimaryValue).toArray();
    }

    public double[] secondaryValues() {
        return samples.stream().mapToDouble(Sample::getSecondaryValue).toArray();
    }
}
