package com.motaz.pipeline.analysis.feature;

import com.motaz.pipeline.analysis.TestSamples;
import com.motaz.pipeline.analysis.exception.ConfigurationException;
import com.motaz.pipeline.analysis.model.AnomalyType;
import com.motaz.pipeline.analysis.model.LabeledWindow;
import com.motaz.pipeline.analysis.model.Sample;
import com.motaz.pipeline.analysis.model.WindowFeatures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WindowFeatureExtractorTest {

    @ParameterizedTest
    @CsvSource({"100,10,1", "100,10,7", "100,100,3", "57,8,4", "1000,400,1"})
    void yieldsOneWindowPerStepThatFits(int n, int window, int step) {
        List<Sample> samples = TestSamples.normalSeries("a1", n, 3);

        List<LabeledWindow> windows = new WindowFeatureExtractor(window, step).extract(samples);

        assertThat(windows).hasSize((n - window) / step + 1);
        for (int i = 0; i < windows.size(); i++) {
            assertThat(windows.get(i).getStartIndex()).isEqualTo(i * step);
        }
    }

    @Test
    void shortSequenceYieldsNoWindows() {
        assertThat(new WindowFeatureExtractor(50, 1).extract(TestSamples.normalSeries("a1", 49, 1))).isEmpty();
    }

    @Test
    void rejectsNonPositiveSizes() {
        assertThatThrownBy(() -> new WindowFeatureExtractor(0, 1)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new WindowFeatureExtractor(10, 0)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void windowIsAnomalousIffItContainsAnAnomalousSample() {
        int window = 4;
        WindowFeatureExtractor extractor = new WindowFeatureExtractor(window, 1);
        for (int offset = 0; offset < 10; offset++) {
            List<Sample> samples = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                samples.add(i == offset
                        ? TestSamples.anomalyAt(i)
                        : TestSamples.normal(i, 2.0 + 0.01 * i, 25.0));
            }

            List<LabeledWindow> windows = extractor.extract(samples);

            for (LabeledWindow w : windows) {
                boolean covers = offset >= w.getStartIndex() && offset < w.getStartIndex() + window;
                assertThat(w.isAnomalous()).as("offset %d, window at %d", offset, w.getStartIndex()).isEqualTo(covers);
                assertThat(w.isAllNormal()).isEqualTo(!covers);
            }
        }
    }

    @Test
    void describesWindowStatistics() {
        List<Sample> samples = List.of(
                TestSamples.normal(0, 1.0, 10.0),
                TestSamples.normal(1, 2.0, 20.0),
                TestSamples.normal(2, 3.0, 30.0),
                TestSamples.normal(3, 4.0, 40.0));

        WindowFeatures f = new WindowFeatureExtractor(4, 1).extract(samples).get(0).getFeatures();

        assertThat(f.getPrimaryMean()).isCloseTo(2.5, within(1e-12));
        assertThat(f.getPrimaryMin()).isEqualTo(1.0);
        assertThat(f.getPrimaryMax()).isEqualTo(4.0);
        assertThat(f.getPrimaryMedian()).isCloseTo(2.5, within(1e-12));
        assertThat(f.getPrimaryP25()).isCloseTo(1.75, within(1e-12));
        assertThat(f.getPrimaryP75()).isCloseTo(3.25, within(1e-12));
        assertThat(f.getPrimaryVariance()).isCloseTo(1.25, within(1e-12));
        assertThat(f.getSecondaryMedian()).isCloseTo(25.0, within(1e-12));
        assertThat(f.getPrimarySlope()).isCloseTo(1.0, within(1e-12));
        assertThat(f.getSecondarySlope()).isCloseTo(10.0, within(1e-12));
        assertThat(f.getCorrelation()).isCloseTo(1.0, within(1e-12));
        assertThat(f.toVector()).hasSize(WindowFeatures.DIMENSION);
    }

    @Test
    void constantSignalHasZeroCorrelation() {
        List<Sample> samples = List.of(
                TestSamples.normal(0, 2.0, 10.0),
                TestSamples.normal(1, 2.0, 11.0),
                TestSamples.normal(2, 2.0, 12.0));

        WindowFeatures f = new WindowFeatureExtractor(3, 1).extract(samples).get(0).getFeatures();

        assertThat(f.getCorrelation()).isZero();
        assertThat(f.getPrimaryStd()).isZero();
    }

    @Test
    void singleSampleWindowHasFiniteFeatures() {
        WindowFeatures f = new WindowFeatureExtractor(1, 1)
                .extract(List.of(TestSamples.sample("a1", 0, 2.0, 25.0, AnomalyType.NORMAL)))
                .get(0).getFeatures();

        assertThat(Arrays.stream(f.toVector()).allMatch(Double::isFinite)).isTrue();
        assertThat(f.getCorrelation()).isZero();
        assertThat(f.getPrimarySlope()).isZero();
    }

    @Test
    void windowsNeverSpanTwoAssets() {
        List<Sample> samples = new ArrayList<>(TestSamples.normalSeries("a1", 30, 1));
        samples.addAll(TestSamples.normalSeries("a2", 25, 2));

        List<LabeledWindow> windows = new WindowFeatureExtractor(10, 5).extractByAsset(samples);

        assertThat(windows).hasSize(5 + 4);
    }
}
