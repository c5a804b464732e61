package com.motaz.pipeline.analysis.correlation;

import com.motaz.pipeline.analysis.model.AnomalyType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CorrelationReport {
    double overallCorrelation;
    double varianceThreshold;
    double correlationThreshold;
    Map<AnomalyType, Double> secondaryVarianceByType;
    int operationallyDistinguishableCount;
    double additionalReductionEstimate;
    boolean aboveThreshold;
}
