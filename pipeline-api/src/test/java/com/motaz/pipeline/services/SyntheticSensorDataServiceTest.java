package com.motaz.pipeline.services;

import com.motaz.pipeline.analysis.model.AnomalyType;
import com.motaz.pipeline.analysis.model.Sample;
import com.motaz.pipeline.analysis.model.Segmentation;
import com.motaz.pipeline.analysis.segmentation.TemporalEventSegmenter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class SyntheticSensorDataServiceTest {

    private SyntheticSensorDataService service;

    @BeforeEach
    void setUp() {
        service = new SyntheticSensorDataService();
        ReflectionTestUtils.setField(service, "assets", 2);
        ReflectionTestUtils.setField(service, "samplesPerAsset", 2000);
        ReflectionTestUtils.setField(service, "samplingSeconds", 2);
        ReflectionTestUtils.setField(service, "leakEvents", 2);
        ReflectionTestUtils.setField(service, "operationalEvents", 4);
        ReflectionTestUtils.setField(service, "defaultSeed", 42L);
    }

    @Test
    void sameSeedGivesSameSeries() {
        List<Sample> first = service.load(5L);
        List<Sample> second = service.load(5L);

        assertThat(first).isEqualTo(second);
        assertThat(service.load(null)).isEqualTo(service.load(42L));
        assertThat(service.load(6L)).isNotEqualTo(first);
    }

    @Test
    void generatesEveryAssetInTimeOrder() {
        List<Sample> samples = service.load(1L);

        assertThat(samples).hasSize(4000);
        assertThat(samples.stream().map(Sample::getAssetId).distinct().collect(Collectors.toList()))
                .containsExactly("pipeline-1", "pipeline-2");
        for (int i = 1; i < 2000; i++) {
            assertThat(samples.get(i).getTimestamp()).isAfter(samples.get(i - 1).getTimestamp());
        }
    }

    @Test
    void injectsSeparateLabelledEvents() {
        List<Sample> samples = service.load(3L);

        assertThat(samples).allSatisfy(s ->
                assertThat(s.isAnomaly()).isEqualTo(s.getAnomalyType() != AnomalyType.NORMAL));
        assertThat(samples).anyMatch(s -> s.getAnomalyType() == AnomalyType.LEAK);
        assertThat(samples).anyMatch(s -> s.getAnomalyType() == AnomalyType.OPERATIONAL);

        // events keep a margin, so every segmented group carries a single type
        Segmentation segmentation = new TemporalEventSegmenter(Duration.ofSeconds(10)).segmentByAsset(samples);
        assertThat(segmentation.getGroups()).allSatisfy(group ->
                assertThat(group.getSamples()).extracting(Sample::getAnomalyType).containsOnly(group.dominantType()));
        assertThat(segmentation.groupCount()).isLessThanOrEqualTo(2 * (2 + 4));
    }
}
