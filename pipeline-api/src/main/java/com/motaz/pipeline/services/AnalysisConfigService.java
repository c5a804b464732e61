package com.motaz.pipeline.services;

import com.motaz.pipeline.analysis.config.AnalysisConfig;
import com.motaz.pipeline.analysis.config.GammaSetting;
import com.motaz.pipeline.analysis.config.KernelType;
import com.motaz.pipeline.analysis.config.LinkageType;
import com.motaz.pipeline.dto.AnalysisRequestDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Merges per-run overrides over the configured defaults and validates the result.
 */
@Slf4j
@Service
public class AnalysisConfigService {

    @Value("${analysis.ocsvm.kernel:rbf}")
    private String kernel;

    @Value("${analysis.ocsvm.nu:0.05}")
    private double nu;

    @Value("${analysis.ocsvm.gamma:auto}")
    private String gamma;

    @Value("${analysis.ocsvm.tolerance:0.001}")
    private double tolerance;

    @Value("${analysis.window.size:400}")
    private int windowSize;

    @Value("${analysis.window.step:1}")
    private int stepSize;

    @Value("${analysis.clustering.n-clusters:10}")
    private int clusters;

    @Value("${analysis.clustering.linkage:ward}")
    private String linkage;

    @Value("${analysis.clustering.min-gap-seconds:10}")
    private long minGapSeconds;

    @Value("${analysis.multisource.variance-threshold:0.1}")
    private double varianceThreshold;

    @Value("${analysis.multisource.correlation-threshold:0.7}")
    private double correlationThreshold;

    public AnalysisConfig defaults() {
        return resolve(null);
    }

    /**
     * @throws com.motaz.pipeline.analysis.exception.ConfigurationException on any invalid value
     */
    public AnalysisConfig resolve(AnalysisRequestDto request) {
        AnalysisRequestDto overrides = request != null ? request : new AnalysisRequestDto();
        AnalysisConfig config = AnalysisConfig.builder()
                .kernel(KernelType.fromName(pick(overrides.getKernel(), kernel)))
                .nu(pick(overrides.getNu(), nu))
                .gamma(GammaSetting.parse(pick(overrides.getGamma(), gamma)))
                .tolerance(tolerance)
                .windowSize(pick(overrides.getWindowSize(), windowSize))
                .stepSize(pick(overrides.getStepSize(), stepSize))
                .clusters(pick(overrides.getNumClusters(), clusters))
                .linkage(LinkageType.fromName(pick(overrides.getLinkage(), linkage)))
                .minGap(Duration.ofSeconds(pick(overrides.getMinGapSeconds(), minGapSeconds)))
                .varianceThreshold(pick(overrides.getVarianceThreshold(), varianceThreshold))
                .correlationThreshold(pick(overrides.getCorrelationThreshold(), correlationThreshold))
                .build()
                .validate();
        log.debug("Resolved analysis config {}", config);
        return config;
    }

    private static <T> T pick(T override, T fallback) {
        return override != null ? override : fallback;
    }
}
