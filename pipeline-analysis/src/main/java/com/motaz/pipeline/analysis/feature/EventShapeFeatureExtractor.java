package com.motaz.pipeline.analysis.feature;

import com.motaz.pipeline.analysis.model.EventFeatureMatrix;
import com.motaz.pipeline.analysis.model.EventFeatures;
import com.motaz.pipeline.analysis.model.EventGroup;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.motaz.pipeline.analysis.feature.SeriesStatistics.finite;

/**
 * Describes the shape of each event group. Groups with fewer than {@value #MIN_GROUP_SIZE}
 * samples carry no shape and are dropped and counted.
 */
@Slf4j
public class EventShapeFeatureExtractor {

    public static final int MIN_GROUP_SIZE = 2;

    public Optional<EventFeatures> describe(EventGroup group) {
        if (group.size() < MIN_GROUP_SIZE) {
            return Optional.empty();
        }
        double[] primary = group.primaryValues();
        double[] secondary = group.secondaryValues();
        double[] primaryDiff = SeriesStatistics.firstDifference(primary);
        double[] secondaryDiff = SeriesStatistics.firstDifference(secondary);

        double roughness = 0.0;
        for (double d : primaryDiff) {
            roughness += Math.abs(d);
        }
        double min = SeriesStatistics.min(primary);
        double max = SeriesStatistics.max(primary);

        return Optional.of(EventFeatures.builder()
                .primaryMean(finite(SeriesStatistics.mean(primary)))
                .primaryStd(finite(SeriesStatistics.std(primary)))
                .primaryMin(finite(min))
                .primaryMax(finite(max))
                .primaryPeakToPeak(finite(max - min))
                .secondaryMean(finite(SeriesStatistics.mean(secondary)))
                .secondaryStd(finite(SeriesStatistics.std(secondary)))
                .secondaryVariance(finite(SeriesStatistics.variance(secondary)))
                .duration(group.size())
                .roughness(finite(roughness))
                .primaryDiffMean(finite(SeriesStatistics.mean(primaryDiff)))
                .primaryDiffStd(finite(SeriesStatistics.std(primaryDiff)))
                .secondaryDiffMean(finite(SeriesStatistics.mean(secondaryDiff)))
                .correlation(finite(SeriesStatistics.pearson(primary, secondary)))
                .primaryArea(finite(SeriesStatistics.trapezoid(primary)))
                .minimumPosition(finite((double) SeriesStatistics.argMin(primary) / primary.length))
                .build());
    }

    /**
     * Describes every group, keeping only those with a shape. Row order follows {@code groups}.
     */
    public EventFeatureMatrix extract(List<EventGroup> groups) {
        List<Optional<EventFeatures>> described = groups.parallelStream()
                .map(this::describe)
                .collect(Collectors.toList());

        List<EventGroup> kept = new ArrayList<>();
        List<EventFeatures> rows = new ArrayList<>();
        int degenerate = 0;
        for (int i = 0; i < groups.size(); i++) {
            Optional<EventFeatures> features = described.get(i);
            if (features.isPresent()) {
                kept.add(groups.get(i));
                rows.add(features.get());
            } else {
                degenerate++;
            }
        }
        if (degenerate > 0) {
            log.debug("Skipped {} event groups with fewer than {} samples", degenerate, MIN_GROUP_SIZE);
        }
        return new EventFeatureMatrix(List.copyOf(kept), List.copyOf(rows), degenerate);
    }
}
