package com.motaz.pipeline.analysis.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Statistical description of one sliding window. Field order is the vector order.
 */
@Value
@Builder
public class WindowFeatures {

    public static final List<String> SCHEMA = List.of(
            "primaryMean", "primaryStd", "primaryMin", "primaryMax", "primaryMedian",
            "primaryP25", "primaryP75",
            "secondaryMean", "secondaryStd", "secondaryMin", "secondaryMax", "secondaryMedian",
            "primarySlope", "secondarySlope",
            "primaryVariance", "secondaryVariance",
            "correlation");

    public static final int DIMENSION = SCHEMA.size();

    double primaryMean;
    double primaryStd;
    double primaryMin;
    double primaryMax;
    double primaryMedian;
    double primaryP25;
    double primaryP75;
    double secondaryMean;
    double secondaryStd;
    double secondaryMin;
    double secondaryMax;
    double secondaryMedian;
    double primarySlope;
    double secondarySlope;
    double primaryVariance;
    double secondaryVariance;
    double correlation;

    public static WindowFeatures fromVector(double[] v) {
        if (v.length != DIMENSION) {
            throw new IllegalArgumentException("Expected " + DIMENSION + " values, got " + v.length);
        }
        return new WindowFeatures(v[0], v[1], v[2], v[3], v[4], v[5], v[6], v[7], v[8], v[9], v[10],
                v[11], v[12], v[13], v[14], v[15], v[16]);
    }

    public double[] toVector() {
        return new double[]{
                primaryMean, primaryStd, primaryMin, primaryMax, primaryMedian, primaryP25, primaryP75,
                secondaryMean, secondaryStd, secondaryMin, secondaryMax, secondaryMedian,
                primarySlope, secondarySlope,
                primaryVariance, secondaryVariance,
                correlation
        };
    }
}
