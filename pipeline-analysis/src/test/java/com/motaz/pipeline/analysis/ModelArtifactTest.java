package com.motaz.pipeline.analysis;

import com.motaz.pipeline.analysis.clustering.ClusteringResult;
import com.motaz.pipeline.analysis.clustering.EventPatternAnalyzer;
import com.motaz.pipeline.analysis.config.AnalysisConfig;
import com.motaz.pipeline.analysis.feature.WindowFeatureExtractor;
import com.motaz.pipeline.analysis.model.EventFeatures;
import com.motaz.pipeline.analysis.model.LabeledWindow;
import com.motaz.pipeline.analysis.model.Sample;
import com.motaz.pipeline.analysis.model.WindowFeatures;
import com.motaz.pipeline.analysis.novelty.OneClassSvmModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModelArtifactTest {

    @Test
    void restoredModelReproducesPredictions() throws Exception {
        AnalysisConfig config = AnalysisConfig.builder().windowSize(20).stepSize(5).clusters(2).build();
        List<Sample> samples = PipelineEndToEndTest.assetWithEvents("a1", 1000, 21);
        List<LabeledWindow> windows = new WindowFeatureExtractor(20, 5).extract(samples);
        OneClassSvmModel model = new OneClassSvmModel(config);
        model.train(windows);
        EventPatternAnalyzer analyzer = new EventPatternAnalyzer(config);
        analyzer.fit(samples);
        ClusteringResult clustering = analyzer.clustering().orElseThrow();

        ModelArtifact restored = ModelArtifact.fromBytes(ModelArtifact.of(config, model, clustering).toBytes());

        assertThat(restored.restoreNoveltyModel().score(windows)).containsExactly(model.score(windows));
        assertThat(restored.getConfig()).isEqualTo(config);
        assertThat(restored.getWindowSchema()).isEqualTo(WindowFeatures.SCHEMA);
        assertThat(restored.getEventSchema()).isEqualTo(EventFeatures.SCHEMA);
        assertThat(restored.clusteringResult()).hasValueSatisfying(c ->
                assertThat(c.getLabels()).containsExactly(clustering.getLabels()));
    }
}
