package com.motaz.pipeline.analysis.segmentation;

import com.motaz.pipeline.analysis.exception.ConfigurationException;
import com.motaz.pipeline.analysis.model.EventGroup;
import com.motaz.pipeline.analysis.model.Sample;
import com.motaz.pipeline.analysis.model.Segmentation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups time-ordered anomalous samples into events. A new event starts at the first sample and
 * whenever the time since the previous sample is larger than {@code minGap}.
 */
@Slf4j
@Getter
public class TemporalEventSegmenter {

    private final Duration minGap;

    public TemporalEventSegmenter(Duration minGap) {
        if (minGap == null || minGap.isNegative()) {
            throw new ConfigurationException("min gap must be zero or positive");
        }
        this.minGap = minGap;
    }

    /**
     * @param anomalies anomalous samples sorted ascending by timestamp
     */
    public Segmentation segment(List<Sample> anomalies) {
        return segment(anomalies, 0);
    }

    /**
     * Filters the anomalous samples and segments each asset on its own, assets in order of first
     * appearance. Ids continue across assets so they stay unique within the call.
     */
    public Segmentation segmentByAsset(List<Sample> samples) {
        Map<String, List<Sample>> byAsset = new LinkedHashMap<>();
        for (Sample sample : samples) {
            if (sample.isAnomaly()) {
                byAsset.computeIfAbsent(sample.getAssetId(), k -> new ArrayList<>()).add(sample);
            }
        }
        List<Sample> ordered = new ArrayList<>();
        List<EventGroup> groups = new ArrayList<>();
        for (List<Sample> assetSamples : byAsset.values()) {
            assetSamples.sort((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()));
            Segmentation assetSegmentation = segment(assetSamples, groups.size());
            log.debug("Asset {}: {} anomalous samples in {} event groups",
                    assetSegmentation.getGroups().get(0).assetId(), assetSamples.size(), assetSegmentation.groupCount());
            ordered.addAll(assetSamples);
            groups.addAll(assetSegmentation.getGroups());
        }
        int[] ids = new int[ordered.size()];
        int position = 0;
        for (EventGroup group : groups) {
            for (int i = 0; i < group.size(); i++) {
                ids[position++] = group.getId();
            }
        }
        log.info("Segmented {} anomalous samples from {} assets into {} event groups",
                ordered.size(), byAsset.size(), groups.size());
        return new Segmentation(ids, List.copyOf(groups));
    }

    private Segmentation segment(List<Sample> anomalies, int firstId) {
        int[] ids = new int[anomalies.size()];
        List<EventGroup> groups = new ArrayList<>();
        List<Sample> current = new ArrayList<>();
        int groupId = firstId;
        for (int i = 0; i < anomalies.size(); i++) {
            Sample sample = anomalies.get(i);
            if (i > 0) {
                Duration elapsed = Duration.between(anomalies.get(i - 1).getTimestamp(), sample.getTimestamp());
                if (elapsed.isNegative()) {
                    throw new IllegalArgumentException("Samples must be sorted by timestamp, index " + i
                            + " goes back in time");
                }
                if (elapsed.compareTo(minGap) > 0) {
                    groups.add(new EventGroup(groupId, List.copyOf(current)));
                    current.clear();
                    groupId++;
                }
            }
            current.add(sample);
            ids[i] = groupId;
        }
        if (!current.isEmpty()) {
            groups.add(new EventGroup(groupId, List.copyOf(current)));
        }
        return new Segmentation(ids, List.copyOf(groups));
    }
}
