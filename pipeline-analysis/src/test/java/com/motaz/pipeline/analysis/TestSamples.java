package com.motaz.pipeline.analysis;

import com.motaz.pipeline.analysis.model.AnomalyType;
import com.motaz.pipeline.analysis.model.Sample;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Sample builders shared by the tests.
 */
public final class TestSamples {

    public static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");

    private TestSamples() {
    }

    public static Sample sample(String asset, long second, double primary, double secondary, AnomalyType type) {
        return Sample.builder()
                .timestamp(EPOCH.plusSeconds(second))
                .assetId(asset)
                .primaryValue(primary)
                .secondaryValue(secondary)
                .anomaly(type != AnomalyType.NORMAL)
                .anomalyType(type)
                .build();
    }

    public static Sample normal(long second, double primary, double secondary) {
        return sample("a1", second, primary, secondary, AnomalyType.NORMAL);
    }

    public static Sample anomalyAt(long second) {
        return sample("a1", second, 1.0, 25.0, AnomalyType.LEAK);
    }

    /**
     * Noisy pressure around 2 MPa and frequency around 25 Hz, one sample per second.
     */
    public static List<Sample> normalSeries(String asset, int n, long seed) {
        Random rnd = new Random(seed);
        List<Sample> samples = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            samples.add(sample(asset, i, 2.0 + 0.05 * rnd.nextGaussian(), 25.0 + 0.5 * rnd.nextGaussian(),
                    AnomalyType.NORMAL));
        }
        return samples;
    }
}
