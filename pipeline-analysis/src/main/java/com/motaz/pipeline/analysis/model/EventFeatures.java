package com.motaz.pipeline.analysis.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Morphology of one event group. Field order is the vector order.
 */
@Value
@Builder
public class EventFeatures {

    public static final List<String> SCHEMA = List.of(
            "primaryMean", "primaryStd", "primaryMin", "primaryMax", "primaryPeakToPeak",
            "secondaryMean", "secondaryStd", "secondaryVariance",
            "duration", "roughness",
            "primaryDiffMean", "primaryDiffStd", "secondaryDiffMean",
            "correlation", "primaryArea", "minimumPosition");

    public static final int DIMENSION = SCHEMA.size();

    double primaryMean;
    double primaryStd;
    double primaryMin;
    double primaryMax;
    double primaryPeakToPeak;
    double secondaryMean;
    double secondaryStd;
    double secondaryVariance;
    double duration;
    double roughness;
    double primaryDiffMean;
    double primaryDiffStd;
    double secondaryDiffMean;
    double correlation;
    double primaryArea;
    double minimumPosition;

    public double[] toVector() {
        return new double[]{
                primaryMean, primaryStd, primaryMin, primaryMax, primaryPeakToPeak,
                secondaryMean, secondaryStd, secondaryVariance,
                duration, roughness,
                primaryDiffMean, primaryDiffStd, secondaryDiffMean,
                correlation, primaryArea, minimumPosition
        };
    }
}
