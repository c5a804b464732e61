package com.motaz.pipeline.dto;

import lombok.Data;

/**
 * Optional overrides for one run. Null fields fall back to the configured defaults.
 */
@Data
public class AnalysisRequestDto {
    private String kernel;
    private Double nu;
    private String gamma;
    private Integer windowSize;
    private Integer stepSize;
    private Integer numClusters;
    private String linkage;
    private Long minGapSeconds;
    private Double varianceThreshold;
    private Double correlationThreshold;
    private Long seed;
}
