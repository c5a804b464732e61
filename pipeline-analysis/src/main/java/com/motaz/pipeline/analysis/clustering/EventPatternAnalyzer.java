package com.motaz.pipeline.analysis.clustering;

import com.motaz.pipeline.analysis.config.AnalysisConfig;
import com.motaz.pipeline.analysis.exception.NoAnomaliesException;
import com.motaz.pipeline.analysis.exception.UntrainedModelException;
import com.motaz.pipeline.analysis.feature.EventShapeFeatureExtractor;
import com.motaz.pipeline.analysis.model.EventFeatureMatrix;
import com.motaz.pipeline.analysis.model.EventFeatures;
import com.motaz.pipeline.analysis.model.Sample;
import com.motaz.pipeline.analysis.model.Segmentation;
import com.motaz.pipeline.analysis.segmentation.TemporalEventSegmenter;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Segments anomalous samples into events, clusters their shapes and attributes the clusters.
 * The fitted state stays until the next {@link #fit(List)}.
 */
@Slf4j
@RequiredArgsConstructor
public class EventPatternAnalyzer {

    private final TemporalEventSegmenter segmenter;
    private final EventShapeFeatureExtractor shapeExtractor;
    private final EventClusterer clusterer;
    private final ClusterAttributor attributor;
    private final int clusters;

    private volatile Fitted fitted;

    public EventPatternAnalyzer(AnalysisConfig config) {
        this(new TemporalEventSegmenter(config.getMinGap()),
                new EventShapeFeatureExtractor(),
                new AgglomerativeClusterer(config.getClusters(), config.getLinkage()),
                new ClusterAttributor(),
                config.getClusters());
    }

    public void fit(List<Sample> samples) {
        Segmentation segmentation = segmenter.segmentByAsset(samples);
        EventFeatureMatrix matrix = shapeExtractor.extract(segmentation.getGroups());
        log.info("Extracted {} event feature rows, {} degenerate groups skipped",
                matrix.rows(), matrix.getDegenerateGroups());
        if (matrix.rows() == 0) {
            log.warn("No event groups with a shape, clustering skipped");
            fitted = new Fitted(segmentation, matrix, null);
            return;
        }
        ClusteringResult result = clusterer.fit(matrix.toMatrix());
        fitted = new Fitted(segmentation, matrix, result);
    }

    public boolean isFitted() {
        return fitted != null;
    }

    public Attribution attribute() {
        Fitted current = requireFitted();
        if (current.getClustering() == null) {
            throw new NoAnomaliesException("No event groups to attribute");
        }
        return attributor.attribute(current.getClustering(), current.getMatrix());
    }

    /**
     * Summary of the last fit. An empty fit reports a reduction of 0.
     */
    public ClusteringReport report() {
        Fitted current = requireFitted();
        ClusteringReport.ClusteringReportBuilder report = ClusteringReport.builder()
                .numClusters(clusters)
                .totalEventGroups(current.getMatrix().rows())
                .degenerateGroups(current.getMatrix().getDegenerateGroups())
                .featureDimension(EventFeatures.DIMENSION);
        try {
            Attribution attribution = attribute();
            OptionalDouble silhouette = SilhouetteScore.of(current.getClustering());
            return report
                    .silhouetteScore(silhouette.isPresent() ? silhouette.getAsDouble() : null)
                    .falsePositiveReduction(attribution.getFalsePositiveReduction())
                    .faultClusterId(attribution.faultCluster().isPresent() ? attribution.getFaultClusterId() : null)
                    .leakGroupsPerCluster(attribution.getLeakGroupsPerCluster())
                    .noLeakGroups(attribution.isDegenerate())
                    .build();
        } catch (NoAnomaliesException e) {
            log.warn("{}, reporting a false positive reduction of 0", e.getMessage());
            return report
                    .falsePositiveReduction(0.0)
                    .leakGroupsPerCluster(new int[0])
                    .build();
        }
    }

    public Optional<ClusteringResult> clustering() {
        return Optional.ofNullable(requireFitted().getClustering());
    }

    public EventFeatureMatrix features() {
        return requireFitted().getMatrix();
    }

    public Segmentation segmentation() {
        return requireFitted().getSegmentation();
    }

    private Fitted requireFitted() {
        Fitted current = fitted;
        if (current == null) {
            throw new UntrainedModelException("Event clustering must be fitted before attribution");
        }
        return current;
    }

    @Value
    private static class Fitted {
        Segmentation segmentation;
        EventFeatureMatrix matrix;
        ClusteringResult clustering;
    }
}
