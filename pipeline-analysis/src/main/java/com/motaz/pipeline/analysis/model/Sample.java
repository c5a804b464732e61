package com.motaz.pipeline.analysis.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * One reading of both signals for an asset. The {@code anomaly} and {@code anomalyType}
 * fields are labels and never enter a feature vector.
 */
@Value
@Builder
public class Sample {
    @NonNull
    Instant timestamp;
    @NonNull
    String assetId;
    double primaryValue;
    double secondaryValue;
    boolean anomaly;
    @NonNull
    @Builder.Default
    AnomalyType anomalyType = AnomalyType.NORMAL;
}
