package com.motaz.pipeline.services;

import com.motaz.pipeline.analysis.model.AnomalyType;
import com.motaz.pipeline.analysis.model.Sample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates pressure / pump frequency series for a few pipelines with injected leak events
 * (gradual pressure drop, frequency roughly stable) and operational events (both signals shift).
 */
@Slf4j
@Service
public class SyntheticSensorDataService implements SensorDataSource {

    @Value("${analysis.data.assets:3}")
    private int assets;

    @Value("${analysis.data.samples-per-asset:4000}")
    private int samplesPerAsset;

    @Value("${analysis.data.sampling-seconds:2}")
    private int samplingSeconds;

    @Value("${analysis.data.leak-events:2}")
    private int leakEvents;

    @Value("${analysis.data.operational-events:8}")
    private int operationalEvents;

    @Value("${analysis.data.seed:42}")
    private long defaultSeed;

    private static final double BASE_PRESSURE = 2.0;
    private static final double BASE_FREQUENCY = 25.0;
    private static final int MAX_PLACEMENT_ATTEMPTS = 50;
    private static final int EVENT_MARGIN = 10;

    @Override
    public List<Sample> load(Long seed) {
        Random rnd = new Random(seed != null ? seed : defaultSeed);
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        List<Sample> samples = new ArrayList<>(assets * samplesPerAsset);
        for (int a = 1; a <= assets; a++) {
            samples.addAll(generateAsset("pipeline-" + a, start, rnd));
        }
        log.info("Generated {} samples for {} assets", samples.size(), assets);
        return samples;
    }

    private List<Sample> generateAsset(String assetId, Instant start, Random rnd) {
        int n = samplesPerAsset;
        double[] pressure = new double[n];
        double[] frequency = new double[n];
        AnomalyType[] types = new AnomalyType[n];
        for (int i = 0; i < n; i++) {
            double hours = i * samplingSeconds / 3600.0;
            pressure[i] = BASE_PRESSURE
                    + 0.3 * Math.sin(2 * Math.PI * hours / 24)
                    + 0.1 * Math.sin(2 * Math.PI * hours)
                    + 0.05 * rnd.nextGaussian();
            frequency[i] = BASE_FREQUENCY
                    + 3 * Math.sin(2 * Math.PI * hours / 12)
                    + 0.5 * rnd.nextGaussian();
            types[i] = AnomalyType.NORMAL;
        }

        int leaks = 0;
        for (int attempt = 0; attempt < MAX_PLACEMENT_ATTEMPTS && leaks < leakEvents; attempt++) {
            int duration = between(rnd, n / 20, n / 8);
            int from = between(rnd, n / 10, n - duration - 1);
            if (isFree(types, from, from + duration)) {
                injectLeak(pressure, frequency, types, from, from + duration, rnd);
                leaks++;
            }
        }
        int operational = 0;
        for (int attempt = 0; attempt < MAX_PLACEMENT_ATTEMPTS && operational < operationalEvents; attempt++) {
            int duration = between(rnd, n / 80, n / 20);
            int from = between(rnd, 0, n - duration - 1);
            if (isFree(types, from, from + duration)) {
                injectOperational(pressure, frequency, types, from, from + duration, rnd);
                operational++;
            }
        }
        log.debug("Asset {}: {} leak and {} operational events", assetId, leaks, operational);

        List<Sample> samples = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            samples.add(Sample.builder()
                    .timestamp(start.plusSeconds((long) i * samplingSeconds))
                    .assetId(assetId)
                    .primaryValue(pressure[i])
                    .secondaryValue(frequency[i])
                    .anomaly(types[i] != AnomalyType.NORMAL)
                    .anomalyType(types[i])
                    .build());
        }
        return samples;
    }

    private static void injectLeak(double[] pressure, double[] frequency, AnomalyType[] types,
                                   int from, int to, Random rnd) {
        double drop = 0.3 + rnd.nextDouble() * 0.5;
        for (int j = from; j < to; j++) {
            double progress = (double) (j - from) / (to - from);
            pressure[j] -= drop * Math.min(1.0, progress * 2);
            frequency[j] += 0.3 * rnd.nextGaussian();
            types[j] = AnomalyType.LEAK;
        }
    }

    private static void injectOperational(double[] pressure, double[] frequency, AnomalyType[] types,
                                          int from, int to, Random rnd) {
        double pressureChange = 0.4 * rnd.nextGaussian();
        double frequencyChange = 5 * rnd.nextGaussian();
        for (int j = from; j < to; j++) {
            pressure[j] += pressureChange;
            frequency[j] += frequencyChange;
            types[j] = AnomalyType.OPERATIONAL;
        }
    }

    /**
     * Requires {@value #EVENT_MARGIN} normal samples on both sides so neighbouring events stay separate groups.
     */
    private static boolean isFree(AnomalyType[] types, int from, int to) {
        for (int j = Math.max(0, from - EVENT_MARGIN); j < Math.min(types.length, to + EVENT_MARGIN); j++) {
            if (types[j] != AnomalyType.NORMAL) {
                return false;
            }
        }
        return true;
    }

    private static int between(Random rnd, int low, int high) {
        return high <= low ? low : low + rnd.nextInt(high - low);
    }
}
