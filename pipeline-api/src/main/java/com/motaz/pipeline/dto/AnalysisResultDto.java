package com.motaz.pipeline.dto;

import com.motaz.pipeline.analysis.clustering.ClusteringReport;
import com.motaz.pipeline.analysis.correlation.CorrelationReport;
import com.motaz.pipeline.analysis.novelty.EvaluationReport;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AnalysisResultDto {
    private String jobId;
    private AnalysisConfigDto config;
    private DataSummaryDto dataSummary;
    private EvaluationReport evaluation;
    private ClusteringReport clustering;
    private CorrelationReport correlation;
    private long processingTimeMillis;
    private Long modelId;
}
