package com.motaz.pipeline.analysis.novelty;

import com.motaz.pipeline.analysis.model.LabeledWindow;

import java.util.List;

/**
 * A boundary learned from normal windows only. Implementations throw
 * {@link com.motaz.pipeline.analysis.exception.UntrainedModelException} when scoring before
 * {@link #train(List)} succeeded.
 */
public interface NoveltyModel {

    /**
     * Fits the model, replacing any earlier state.
     */
    void train(List<LabeledWindow> windows);

    boolean isTrained();

    /**
     * Decision values; a non-negative value means inlier.
     */
    double[] score(List<LabeledWindow> windows);

    /**
     * Outlier flag per window.
     */
    boolean[] predict(List<LabeledWindow> windows);

    /**
     * Compares {@link #predict(List)} with each window's label.
     */
    default EvaluationReport evaluate(List<LabeledWindow> windows) {
        boolean[] predicted = predict(windows);
        boolean[] actual = new boolean[windows.size()];
        for (int i = 0; i < actual.length; i++) {
            actual[i] = windows.get(i).isAnomalous();
        }
        return EvaluationReport.of(predicted, actual);
    }
}
