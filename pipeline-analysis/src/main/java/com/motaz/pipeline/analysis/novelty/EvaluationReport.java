package com.motaz.pipeline.analysis.novelty;

import lombok.Builder;
import lombok.Value;

/**
 * Window-level detection quality against ground truth.
 */
@Value
@Builder
public class EvaluationReport {
    double precision;
    double recall;
    double f1;
    int totalWindows;
    int predictedAnomalies;
    int trueAnomalies;

    /**
     * Undefined ratios (no predicted positives, no actual positives) are reported as 0.
     */
    public static EvaluationReport of(boolean[] predicted, boolean[] actual) {
        if (predicted.length != actual.length) {
            throw new IllegalArgumentException("Predictions and ground truth differ in length: "
                    + predicted.length + " vs " + actual.length);
        }
        int tp = 0;
        int fp = 0;
        int fn = 0;
        for (int i = 0; i < predicted.length; i++) {
            if (predicted[i] && actual[i]) {
                tp++;
            } else if (predicted[i]) {
                fp++;
            } else if (actual[i]) {
                fn++;
            }
        }
        double precision = tp + fp == 0 ? 0.0 : (double) tp / (tp + fp);
        double recall = tp + fn == 0 ? 0.0 : (double) tp / (tp + fn);
        double f1 = precision + recall == 0.0 ? 0.0 : 2 * precision * recall / (precision + recall);
        return EvaluationReport.builder()
                .precision(precision)
                .recall(recall)
                .f1(f1)
                .totalWindows(predicted.length)
                .predictedAnomalies(tp + fp)
                .trueAnomalies(tp + fn)
                .build();
    }
}
