package com.motaz.pipeline.analysis.feature;

import com.motaz.pipeline.analysis.exception.ConfigurationException;
import com.motaz.pipeline.analysis.model.AnomalyType;
import com.motaz.pipeline.analysis.model.LabeledWindow;
import com.motaz.pipeline.analysis.model.Sample;
import com.motaz.pipeline.analysis.model.WindowFeatures;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.motaz.pipeline.analysis.feature.SeriesStatistics.finite;

/**
 * Slides a fixed-size window over an ordered sample sequence and describes each window with
 * {@link WindowFeatures}. Windows are independent, so they are computed in parallel; the result
 * keeps start-index order.
 */
@Slf4j
@Getter
public class WindowFeatureExtractor {

    private final int windowSize;
    private final int stepSize;

    public WindowFeatureExtractor(int windowSize, int stepSize) {
        if (windowSize <= 0) {
            throw new ConfigurationException("window size must be positive, got " + windowSize);
        }
        if (stepSize <= 0) {
            throw new ConfigurationException("step size must be positive, got " + stepSize);
        }
        this.windowSize = windowSize;
        this.stepSize = stepSize;
    }

    /**
     * Number of windows a sequence of {@code length} samples yields.
     */
    public int windowCount(int length) {
        return length < windowSize ? 0 : (length - windowSize) / stepSize + 1;
    }

    public List<LabeledWindow> extract(List<Sample> samples) {
        int count = windowCount(samples.size());
        if (count == 0) {
            log.debug("Sequence of {} samples is shorter than window size {}", samples.size(), windowSize);
            return List.of();
        }
        double[] primary = samples.stream().mapToDouble(Sample::getPrimaryValue).toArray();
        double[] secondary = samples.stream().mapToDouble(Sample::getSecondaryValue).toArray();
        return IntStream.range(0, count)
                .parallel()
                .mapToObj(w -> window(samples, primary, secondary, w * stepSize))
                .collect(Collectors.toList());
    }

    /**
     * Windows each asset's samples separately, in first-appearance order of the assets, so no
     * window spans two assets.
     */
    public List<LabeledWindow> extractByAsset(List<Sample> samples) {
        Map<String, List<Sample>> byAsset = new LinkedHashMap<>();
        for (Sample sample : samples) {
            byAsset.computeIfAbsent(sample.getAssetId(), k -> new ArrayList<>()).add(sample);
        }
        List<LabeledWindow> windows = new ArrayList<>();
        byAsset.forEach((assetId, assetSamples) -> {
            List<LabeledWindow> assetWindows = extract(assetSamples);
            log.debug("Asset {}: {} samples -> {} windows", assetId, assetSamples.size(), assetWindows.size());
            windows.addAll(assetWindows);
        });
        return windows;
    }

    public WindowFeatures describe(double[] primary, double[] secondary) {
        return WindowFeatures.builder()
                .primaryMean(finite(SeriesStatistics.mean(primary)))
                .primaryStd(finite(SeriesStatistics.std(primary)))
                .primaryMin(finite(SeriesStatistics.min(primary)))
                .primaryMax(finite(SeriesStatistics.max(primary)))
                .primaryMedian(finite(SeriesStatistics.median(primary)))
                .primaryP25(finite(SeriesStatistics.percentile(primary, 25)))
                .primaryP75(finite(SeriesStatistics.percentile(primary, 75)))
                .secondaryMean(finite(SeriesStatistics.mean(secondary)))
                .secondaryStd(finite(SeriesStatistics.std(secondary)))
                .secondaryMin(finite(SeriesStatistics.min(secondary)))
                .secondaryMax(finite(SeriesStatistics.max(secondary)))
                .secondaryMedian(finite(SeriesStatistics.median(secondary)))
                .primarySlope(finite(SeriesStatistics.slope(primary)))
                .secondarySlope(finite(SeriesStatistics.slope(secondary)))
                .primaryVariance(finite(SeriesStatistics.variance(primary)))
                .secondaryVariance(finite(SeriesStatistics.variance(secondary)))
                .correlation(finite(SeriesStatistics.pearson(primary, secondary)))
                .build();
    }

    private LabeledWindow window(List<Sample> samples, double[] primary, double[] secondary, int start) {
        int end = start + windowSize;
        boolean anomalous = false;
        boolean allNormal = true;
        for (int i = start; i < end; i++) {
            Sample sample = samples.get(i);
            anomalous |= sample.isAnomaly();
            allNormal &= sample.getAnomalyType() == AnomalyType.NORMAL;
        }
        WindowFeatures features = describe(
                Arrays.copyOfRange(primary, start, end),
                Arrays.copyOfRange(secondary, start, end));
        return new LabeledWindow(start, features, anomalous, allNormal);
    }
}
