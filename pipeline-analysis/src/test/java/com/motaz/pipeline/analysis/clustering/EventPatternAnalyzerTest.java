package com.motaz.pipeline.analysis.clustering;

import com.motaz.pipeline.analysis.config.AnalysisConfig;
import com.motaz.pipeline.analysis.config.LinkageType;
import com.motaz.pipeline.analysis.exception.NoAnomaliesException;
import com.motaz.pipeline.analysis.exception.UntrainedModelException;
import com.motaz.pipeline.analysis.model.AnomalyType;
import com.motaz.pipeline.analysis.model.Sample;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.motaz.pipeline.analysis.TestSamples.normalSeries;
import static com.motaz.pipeline.analysis.TestSamples.sample;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventPatternAnalyzerTest {

    private final AnalysisConfig config = AnalysisConfig.builder()
            .clusters(2)
            .linkage(LinkageType.WARD)
            .build();

    @Test
    void attributionBeforeFitFails() {
        EventPatternAnalyzer analyzer = new EventPatternAnalyzer(config);

        assertThat(analyzer.isFitted()).isFalse();
        assertThatThrownBy(analyzer::attribute).isInstanceOf(UntrainedModelException.class);
        assertThatThrownBy(analyzer::report).isInstanceOf(UntrainedModelException.class);
    }

    @Test
    void separatesLeakFromOperationalEvent() {
        EventPatternAnalyzer analyzer = new EventPatternAnalyzer(config);

        analyzer.fit(withEvents());
        Attribution attribution = analyzer.attribute();
        ClusteringReport report = analyzer.report();

        assertThat(analyzer.segmentation().groupCount()).isEqualTo(2);
        assertThat(attribution.getTotalGroups()).isEqualTo(2);
        assertThat(attribution.getFalsePositiveReduction()).isEqualTo(50.0);
        int leakRow = analyzer.features().getGroups().get(0).dominantType() == AnomalyType.LEAK ? 0 : 1;
        int leakCluster = analyzer.clustering().orElseThrow().getLabels()[leakRow];
        assertThat(attribution.getFaultClusterId()).isEqualTo(leakCluster);
        assertThat(report.getNumClusters()).isEqualTo(2);
        assertThat(report.getFaultClusterId()).isEqualTo(leakCluster);
        assertThat(report.getSilhouetteScore()).isNull();
        assertThat(report.isNoLeakGroups()).isFalse();
    }

    @Test
    void fitWithoutAnomaliesReportsZeroReduction() {
        EventPatternAnalyzer analyzer = new EventPatternAnalyzer(config);

        analyzer.fit(normalSeries("a1", 100, 1));

        assertThat(analyzer.clustering()).isEmpty();
        assertThatThrownBy(analyzer::attribute).isInstanceOf(NoAnomaliesException.class);
        ClusteringReport report = analyzer.report();
        assertThat(report.getFalsePositiveReduction()).isZero();
        assertThat(report.getTotalEventGroups()).isZero();
        assertThat(report.getFaultClusterId()).isNull();
    }

    static List<Sample> withEvents() {
        List<Sample> samples = new ArrayList<>(normalSeries("a1", 1000, 4));
        for (int i = 0; i < 200; i++) {
            Sample base = samples.get(100 + i);
            double drop = 0.6 * Math.min(1.0, i / 100.0);
            samples.set(100 + i, sample("a1", 100 + i, base.getPrimaryValue() - drop, base.getSecondaryValue(),
                    AnomalyType.LEAK));
        }
        for (int i = 0; i < 100; i++) {
            Sample base = samples.get(600 + i);
            samples.set(600 + i, sample("a1", 600 + i, base.getPrimaryValue() + 0.4, base.getSecondaryValue() + 6.0,
                    AnomalyType.OPERATIONAL));
        }
        return samples;
    }
}
