package com.motaz.pipeline.analysis.correlation;

import com.motaz.pipeline.analysis.config.AnalysisConfig;
import com.motaz.pipeline.analysis.feature.SeriesStatistics;
import com.motaz.pipeline.analysis.model.AnomalyType;
import com.motaz.pipeline.analysis.model.Sample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-signal evidence that works without clustering. An anomaly type whose secondary signal
 * varies more than the threshold is visible on the pump side too, which points at an operational
 * cause.
 */
@Slf4j
@RequiredArgsConstructor
public class CorrelationAnalyzer {

    private final double varianceThreshold;
    private final double correlationThreshold;

    public CorrelationAnalyzer(AnalysisConfig config) {
        this(config.getVarianceThreshold(), config.getCorrelationThreshold());
    }

    /**
     * @param samples any samples; only anomalous ones are considered
     */
    public CorrelationReport analyze(List<Sample> samples) {
        Map<AnomalyType, List<Double>> secondaryByType = new EnumMap<>(AnomalyType.class);
        List<Double> primary = new ArrayList<>();
        List<Double> secondary = new ArrayList<>();
        for (Sample sample : samples) {
            if (!sample.isAnomaly()) {
                continue;
            }
            primary.add(sample.getPrimaryValue());
            secondary.add(sample.getSecondaryValue());
            if (sample.getAnomalyType() != AnomalyType.NORMAL) {
                secondaryByType.computeIfAbsent(sample.getAnomalyType(), k -> new ArrayList<>())
                        .add(sample.getSecondaryValue());
            }
        }

        Map<AnomalyType, Double> variances = new EnumMap<>(AnomalyType.class);
        int distinguishable = 0;
        for (Map.Entry<AnomalyType, List<Double>> entry : secondaryByType.entrySet()) {
            double variance = SeriesStatistics.finite(SeriesStatistics.variance(toArray(entry.getValue())));
            variances.put(entry.getKey(), variance);
            if (entry.getKey() == AnomalyType.OPERATIONAL && variance > varianceThreshold) {
                distinguishable++;
            }
        }
        double estimate = (double) distinguishable / Math.max(secondaryByType.size(), 1) * 100.0;
        double correlation = SeriesStatistics.finite(SeriesStatistics.pearson(toArray(primary), toArray(secondary)));

        log.info("Correlation over {} anomalous samples: {} (threshold {}), secondary variance by type {}",
                primary.size(), correlation, correlationThreshold, variances);
        return CorrelationReport.builder()
                .overallCorrelation(correlation)
                .varianceThreshold(varianceThreshold)
                .correlationThreshold(correlationThreshold)
                .secondaryVarianceByType(Collections.unmodifiableMap(variances))
                .operationallyDistinguishableCount(distinguishable)
                .additionalReductionEstimate(estimate)
                .aboveThreshold(correlation > correlationThreshold)
                .build();
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
