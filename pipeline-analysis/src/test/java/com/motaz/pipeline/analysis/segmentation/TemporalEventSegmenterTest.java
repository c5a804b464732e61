package com.motaz.pipeline.analysis.segmentation;

import com.motaz.pipeline.analysis.exception.ConfigurationException;
import com.motaz.pipeline.analysis.model.AnomalyType;
import com.motaz.pipeline.analysis.model.EventGroup;
import com.motaz.pipeline.analysis.model.Sample;
import com.motaz.pipeline.analysis.model.Segmentation;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.motaz.pipeline.analysis.TestSamples.anomalyAt;
import static com.motaz.pipeline.analysis.TestSamples.normal;
import static com.motaz.pipeline.analysis.TestSamples.sample;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemporalEventSegmenterTest {

    private final TemporalEventSegmenter segmenter = new TemporalEventSegmenter(Duration.ofSeconds(10));

    @Test
    void splitsWhereTheGapExceedsTheThreshold() {
        List<Sample> anomalies = List.of(anomalyAt(0), anomalyAt(5), anomalyAt(6), anomalyAt(20), anomalyAt(21));

        Segmentation segmentation = segmenter.segment(anomalies);

        assertThat(segmentation.getGroupIds()).containsExactly(0, 0, 0, 1, 1);
        assertThat(segmentation.groupCount()).isEqualTo(2);
        assertThat(segmentation.getGroups().get(0).size()).isEqualTo(3);
        assertThat(segmentation.getGroups().get(1).size()).isEqualTo(2);
    }

    @Test
    void gapEqualToTheThresholdStaysInTheSameGroup() {
        Segmentation segmentation = segmenter.segment(List.of(anomalyAt(0), anomalyAt(10), anomalyAt(21)));

        assertThat(segmentation.getGroupIds()).containsExactly(0, 0, 1);
    }

    @Test
    void emptyInputGivesNoGroups() {
        Segmentation segmentation = segmenter.segment(List.of());

        assertThat(segmentation.getGroupIds()).isEmpty();
        assertThat(segmentation.getGroups()).isEmpty();
    }

    @Test
    void rejectsSamplesOutOfTimeOrder() {
        assertThatThrownBy(() -> segmenter.segment(List.of(anomalyAt(5), anomalyAt(3))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativeGap() {
        assertThatThrownBy(() -> new TemporalEventSegmenter(Duration.ofSeconds(-1)))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void segmentsEachAssetOnItsOwnWithGlobalIds() {
        List<Sample> samples = List.of(
                sample("b", 1, 1.0, 25.0, AnomalyType.OPERATIONAL),
                sample("a", 0, 1.0, 25.0, AnomalyType.LEAK),
                sample("a", 2, 1.0, 25.0, AnomalyType.LEAK),
                normal(3, 2.0, 25.0),
                sample("b", 2, 1.0, 25.0, AnomalyType.OPERATIONAL),
                sample("a", 100, 1.0, 25.0, AnomalyType.LEAK));

        Segmentation segmentation = segmenter.segmentByAsset(samples);

        List<EventGroup> groups = segmentation.getGroups();
        assertThat(groups).extracting(EventGroup::getId).containsExactly(0, 1, 2);
        assertThat(groups).extracting(EventGroup::assetId).containsExactly("b", "a", "a");
        assertThat(groups).extracting(EventGroup::size).containsExactly(2, 2, 1);
        assertThat(groups.get(0).dominantType()).isEqualTo(AnomalyType.OPERATIONAL);
        assertThat(segmentation.getGroupIds()).containsExactly(0, 0, 1, 1, 2);
    }

    @Test
    void sortsEachAssetBeforeSegmenting() {
        List<Sample> samples = List.of(anomalyAt(30), anomalyAt(0), anomalyAt(31), anomalyAt(1));

        Segmentation segmentation = segmenter.segmentByAsset(samples);

        assertThat(segmentation.groupCount()).isEqualTo(2);
        assertThat(segmentation.getGroups().get(0).getSamples())
                .extracting(s -> s.getTimestamp().getEpochSecond() % 60)
                .containsExactly(0L, 1L);
    }
}
