package com.motaz.pipeline.analysis.config;

import com.motaz.pipeline.analysis.exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.time.Duration;

/**
 * Settings shared by every stage of one analysis run.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    @Builder.Default
    KernelType kernel = KernelType.RBF;
    @Builder.Default
    double nu = 0.05;
    @Builder.Default
    GammaSetting gamma = GammaSetting.AUTO;
    @Builder.Default
    double tolerance = 1E-3;
    @Builder.Default
    int windowSize = 400;
    @Builder.Default
    int stepSize = 1;
    @Builder.Default
    int clusters = 10;
    @Builder.Default
    LinkageType linkage = LinkageType.WARD;
    @Builder.Default
    Duration minGap = Duration.ofSeconds(10);
    @Builder.Default
    double varianceThreshold = 0.1;
    @Builder.Default
    double correlationThreshold = 0.7;

    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder().build();
    }

    /**
     * Fails on the first invalid value. Called before any stage runs.
     */
    public AnalysisConfig validate() {
        if (kernel == null) {
            throw new ConfigurationException("kernel must be set");
        }
        if (linkage == null) {
            throw new ConfigurationException("linkage must be set");
        }
        if (gamma == null) {
            throw new ConfigurationException("gamma must be set");
        }
        if (!(nu > 0 && nu <= 1)) {
            throw new ConfigurationException("nu must be in (0, 1], got " + nu);
        }
        if (!(tolerance > 0)) {
            throw new ConfigurationException("tolerance must be positive, got " + tolerance);
        }
        if (windowSize <= 0) {
            throw new ConfigurationException("window size must be positive, got " + windowSize);
        }
        if (stepSize <= 0) {
            throw new ConfigurationException("step size must be positive, got " + stepSize);
        }
        if (clusters <= 0) {
            throw new ConfigurationException("cluster count must be positive, got " + clusters);
        }
        if (minGap == null || minGap.isNegative()) {
            throw new ConfigurationException("min gap must be zero or positive");
        }
        if (Double.isNaN(varianceThreshold) || Double.isNaN(correlationThreshold)) {
            throw new ConfigurationException("thresholds must be numbers");
        }
        return this;
    }
}
