package com.motaz.pipeline.analysis.feature;

import smile.math.MathEx;

import java.util.Arrays;

/**
 * Descriptive statistics over a single signal. Variance and standard deviation are population
 * statistics; percentiles interpolate linearly between the closest ranks.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {
    }

    public static double mean(double[] x) {
        return MathEx.mean(x);
    }

    public static double min(double[] x) {
        return MathEx.min(x);
    }

    public static double max(double[] x) {
        return MathEx.max(x);
    }

    public static double variance(double[] x) {
        if (x.length == 0) {
            return Double.NaN;
        }
        double mean = mean(x);
        double sum = 0.0;
        for (double v : x) {
            double d = v - mean;
            sum += d * d;
        }
        return sum / x.length;
    }

    public static double std(double[] x) {
        return Math.sqrt(variance(x));
    }

    public static double median(double[] x) {
        return percentile(x, 50.0);
    }

    public static double percentile(double[] x, double p) {
        if (x.length == 0) {
            return Double.NaN;
        }
        double[] sorted = x.clone();
        Arrays.sort(sorted);
        double rank = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    /**
     * Least-squares slope of {@code x} against its index.
     */
    public static double slope(double[] x) {
        int n = x.length;
        if (n < 2) {
            return 0.0;
        }
        double indexMean = (n - 1) / 2.0;
        double valueMean = mean(x);
        double covariance = 0.0;
        double spread = 0.0;
        for (int i = 0; i < n; i++) {
            double di = i - indexMean;
            covariance += di * (x[i] - valueMean);
            spread += di * di;
        }
        return covariance / spread;
    }

    /**
     * Pearson correlation, 0 when fewer than two points or when either signal is constant.
     */
    public static double pearson(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n < 2) {
            return 0.0;
        }
        double mx = 0.0;
        double my = 0.0;
        for (int i = 0; i < n; i++) {
            mx += x[i];
            my += y[i];
        }
        mx /= n;
        my /= n;
        double sxy = 0.0;
        double sxx = 0.0;
        double syy = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - mx;
            double dy = y[i] - my;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0.0 || syy == 0.0) {
            return 0.0;
        }
        return sxy / Math.sqrt(sxx * syy);
    }

    public static double[] firstDifference(double[] x) {
        if (x.length < 2) {
            return new double[0];
        }
        double[] diff = new double[x.length - 1];
        for (int i = 1; i < x.length; i++) {
            diff[i - 1] = x[i] - x[i - 1];
        }
        return diff;
    }

    /**
     * Trapezoidal integral with unit spacing.
     */
    public static double trapezoid(double[] x) {
        double area = 0.0;
        for (int i = 1; i < x.length; i++) {
            area += (x[i] + x[i - 1]) / 2.0;
        }
        return area;
    }

    /**
     * Index of the first occurrence of the minimum.
     */
    public static int argMin(double[] x) {
        int index = 0;
        for (int i = 1; i < x.length; i++) {
            if (x[i] < x[index]) {
                index = i;
            }
        }
        return index;
    }

    /**
     * Replaces NaN and infinities with 0.
     */
    public static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
