package com.motaz.pipeline.analysis.novelty;

import com.motaz.pipeline.analysis.config.GammaSetting;
import com.motaz.pipeline.analysis.config.KernelType;
import com.motaz.pipeline.analysis.feature.FeatureScaler;
import lombok.Value;
import smile.anomaly.SVM;

import java.io.Serializable;

/**
 * Everything needed to score windows without retraining.
 */
@Value
public class NoveltyModelState implements Serializable {

    private static final long serialVersionUID = 1L;

    KernelType kernel;
    GammaSetting gamma;
    double resolvedGamma;
    double nu;
    FeatureScaler scaler;
    SVM<double[]> boundary;
    /**
     * +1 or -1, applied to every decision value so that outliers score below zero.
     */
    double orientation;
    int trainedRows;
}
