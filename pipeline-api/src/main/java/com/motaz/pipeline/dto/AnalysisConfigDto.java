package com.motaz.pipeline.dto;

import com.motaz.pipeline.analysis.config.AnalysisConfig;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AnalysisConfigDto {
    private String kernel;
    private double nu;
    private String gamma;
    private double tolerance;
    private int windowSize;
    private int stepSize;
    private int numClusters;
    private String linkage;
    private long minGapSeconds;
    private double varianceThreshold;
    private double correlationThreshold;

    public static AnalysisConfigDto from(AnalysisConfig config) {
        return AnalysisConfigDto.builder()
                .kernel(config.getKernel().label())
                .nu(config.getNu())
                .gamma(config.getGamma().toString())
                .tolerance(config.getTolerance())
                .windowSize(config.getWindowSize())
                .stepSize(config.getStepSize())
                .numClusters(config.getClusters())
                .linkage(config.getLinkage().label())
                .minGapSeconds(config.getMinGap().getSeconds())
                .varianceThreshold(config.getVarianceThreshold())
                .correlationThreshold(config.getCorrelationThreshold())
                .build();
    }
}
