package com.motaz.pipeline.analysis.feature;

import com.motaz.pipeline.analysis.exception.InsufficientDataException;
import lombok.Getter;

import java.io.Serializable;

/**
 * Per-dimension zero-mean, unit-variance scaling. A dimension without spread is only centered.
 */
@Getter
public class FeatureScaler implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] mean;
    private final double[] scale;

    private FeatureScaler(double[] mean, double[] scale) {
        this.mean = mean;
        this.scale = scale;
    }

    public static FeatureScaler fit(double[][] data) {
        if (data.length == 0) {
            throw new InsufficientDataException("Cannot fit a scaler on zero rows");
        }
        int d = data[0].length;
        double[] mean = new double[d];
        double[] scale = new double[d];
        for (double[] row : data) {
            for (int j = 0; j < d; j++) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < d; j++) {
            mean[j] /= data.length;
        }
        for (double[] row : data) {
            for (int j = 0; j < d; j++) {
                double diff = row[j] - mean[j];
                scale[j] += diff * diff;
            }
        }
        for (int j = 0; j < d; j++) {
            double std = Math.sqrt(scale[j] / data.length);
            scale[j] = std > 0 && Double.isFinite(std) ? std : 1.0;
        }
        return new FeatureScaler(mean, scale);
    }

    public int dimension() {
        return mean.length;
    }

    public double[] transform(double[] x) {
        if (x.length != mean.length) {
            throw new IllegalArgumentException("Expected " + mean.length + " features, got " + x.length);
        }
        double[] scaled = new double[x.length];
        for (int j = 0; j < x.length; j++) {
            scaled[j] = (x[j] - mean[j]) / scale[j];
        }
        return scaled;
    }

    public double[][] transform(double[][] data) {
        double[][] scaled = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            scaled[i] = transform(data[i]);
        }
        return scaled;
    }
}
