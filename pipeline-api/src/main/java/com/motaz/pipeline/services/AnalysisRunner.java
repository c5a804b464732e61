package com.motaz.pipeline.services;

import com.motaz.pipeline.analysis.ModelArtifact;
import com.motaz.pipeline.analysis.clustering.ClusteringReport;
import com.motaz.pipeline.analysis.clustering.EventPatternAnalyzer;
import com.motaz.pipeline.analysis.config.AnalysisConfig;
import com.motaz.pipeline.analysis.correlation.CorrelationAnalyzer;
import com.motaz.pipeline.analysis.correlation.CorrelationReport;
import com.motaz.pipeline.analysis.exception.InsufficientDataException;
import com.motaz.pipeline.analysis.feature.WindowFeatureExtractor;
import com.motaz.pipeline.analysis.model.LabeledWindow;
import com.motaz.pipeline.analysis.model.Sample;
import com.motaz.pipeline.analysis.novelty.EvaluationReport;
import com.motaz.pipeline.analysis.novelty.OneClassSvmModel;
import com.motaz.pipeline.dto.AnalysisConfigDto;
import com.motaz.pipeline.dto.AnalysisResultDto;
import com.motaz.pipeline.dto.DataSummaryDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the stages of one analysis in order and reports a checkpoint at every stage boundary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisRunner {

    public static final String STAGE_DATA = "Data Generation";
    public static final String STAGE_TRAINING = "Novelty Training";
    public static final String STAGE_DETECTION = "Anomaly Detection";
    public static final String STAGE_CLUSTERING = "Hierarchical Clustering";
    public static final String STAGE_MULTISOURCE = "Multi-source Analysis";

    private final SensorDataSource sensorDataSource;
    private final ModelRegistryService modelRegistryService;

    @Value("${analysis.train-split:0.8}")
    private double trainSplit;

    public AnalysisResultDto run(String jobId, AnalysisConfig config, Long seed, ProgressListener progress)
            throws IOException {
        long started = System.currentTimeMillis();

        progress.checkpoint(STAGE_DATA, 10);
        List<Sample> samples = sensorDataSource.load(seed);
        if (samples.isEmpty()) {
            throw new InsufficientDataException("No samples to analyze");
        }
        DataSummaryDto summary = DataSummaryDto.of(samples);
        log.info("Loaded {} samples, {} anomalous", summary.getTotalSamples(), summary.getAnomalies());
        progress.checkpoint(STAGE_DATA, 25);

        progress.checkpoint(STAGE_TRAINING, 30);
        List<Sample> train = new ArrayList<>();
        List<Sample> test = new ArrayList<>();
        splitPerAsset(samples, train, test);
        WindowFeatureExtractor extractor = new WindowFeatureExtractor(config.getWindowSize(), config.getStepSize());
        List<LabeledWindow> trainWindows = requireWindows(extractor.extractByAsset(train), "training", config);
        OneClassSvmModel noveltyModel = new OneClassSvmModel(config);
        noveltyModel.train(trainWindows);
        progress.checkpoint(STAGE_TRAINING, 50);

        progress.checkpoint(STAGE_DETECTION, 55);
        List<LabeledWindow> testWindows = requireWindows(extractor.extractByAsset(test), "test", config);
        EvaluationReport evaluation = noveltyModel.evaluate(testWindows);
        progress.checkpoint(STAGE_DETECTION, 70);

        progress.checkpoint(STAGE_CLUSTERING, 75);
        EventPatternAnalyzer patternAnalyzer = new EventPatternAnalyzer(config);
        patternAnalyzer.fit(samples);
        ClusteringReport clustering = patternAnalyzer.report();
        progress.checkpoint(STAGE_CLUSTERING, 90);

        progress.checkpoint(STAGE_MULTISOURCE, 95);
        CorrelationReport correlation = new CorrelationAnalyzer(config).analyze(samples);

        ModelArtifact artifact = ModelArtifact.of(config, noveltyModel, patternAnalyzer.clustering().orElse(null));
        Long modelId = modelRegistryService.save(artifact, "One-class SVM and event clustering from job " + jobId);

        long elapsed = System.currentTimeMillis() - started;
        log.info("Analysis {} finished in {} ms", jobId, elapsed);
        return AnalysisResultDto.builder()
                .jobId(jobId)
                .config(AnalysisConfigDto.from(config))
                .dataSummary(summary)
                .evaluation(evaluation)
                .clustering(clustering)
                .correlation(correlation)
                .processingTimeMillis(elapsed)
                .modelId(modelId)
                .build();
    }

    /**
     * The first {@code trainSplit} share of every asset's series trains, the rest tests.
     */
    private void splitPerAsset(List<Sample> samples, List<Sample> train, List<Sample> test) {
        Map<String, List<Sample>> byAsset = new LinkedHashMap<>();
        for (Sample sample : samples) {
            byAsset.computeIfAbsent(sample.getAssetId(), k -> new ArrayList<>()).add(sample);
        }
        byAsset.values().forEach(assetSamples -> {
            int cut = (int) (assetSamples.size() * trainSplit);
            train.addAll(assetSamples.subList(0, cut));
            test.addAll(assetSamples.subList(cut, assetSamples.size()));
        });
        log.info("Split into {} training and {} test samples", train.size(), test.size());
    }

    private static List<LabeledWindow> requireWindows(List<LabeledWindow> windows, String split, AnalysisConfig config) {
        if (windows.isEmpty()) {
            throw new InsufficientDataException("No " + split + " windows: every asset has fewer than "
                    + config.getWindowSize() + " " + split + " samples");
        }
        return windows;
    }
}
