package com.motaz.pipeline.dto;

import com.motaz.pipeline.analysis.model.Sample;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class DataSummaryDto {
    private int totalSamples;
    private int normalSamples;
    private int anomalies;
    private int trueAnomalies;
    private int falseAnomalies;
    private int assets;

    public static DataSummaryDto of(List<Sample> samples) {
        int normal = 0;
        int anomalies = 0;
        int leak = 0;
        int operational = 0;
        for (Sample sample : samples) {
            if (sample.isAnomaly()) {
                anomalies++;
            }
            switch (sample.getAnomalyType()) {
                case NORMAL -> normal++;
                case LEAK -> leak++;
                case OPERATIONAL -> operational++;
            }
        }
        return DataSummaryDto.builder()
                .totalSamples(samples.size())
                .normalSamples(normal)
                .anomalies(anomalies)
                .trueAnomalies(leak)
                .falseAnomalies(operational)
                .assets((int) samples.stream().map(Sample::getAssetId).distinct().count())
                .build();
    }
}
