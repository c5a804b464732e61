package com.motaz.pipeline.dto;

import com.motaz.pipeline.analysis.model.Sample;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class SampleDto {
    private Instant timestamp;
    private String assetId;
    private double pressureMpa;
    private double frequencyHz;
    private boolean anomaly;
    private String anomalyType;

    public static SampleDto from(Sample sample) {
        return SampleDto.builder()
                .timestamp(sample.getTimestamp())
                .assetId(sample.getAssetId())
                .pressureMpa(sample.getPrimaryValue())
                .frequencyHz(sample.getSecondaryValue())
                .anomaly(sample.isAnomaly())
                .anomalyType(sample.getAnomalyType().label())
                .build();
    }
}
