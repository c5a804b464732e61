package com.motaz.pipeline.analysis.novelty;

import com.motaz.pipeline.analysis.config.AnalysisConfig;
import com.motaz.pipeline.analysis.config.GammaSetting;
import com.motaz.pipeline.analysis.config.KernelType;
import com.motaz.pipeline.analysis.exception.InsufficientDataException;
import com.motaz.pipeline.analysis.exception.UntrainedModelException;
import com.motaz.pipeline.analysis.feature.FeatureScaler;
import com.motaz.pipeline.analysis.model.LabeledWindow;
import lombok.extern.slf4j.Slf4j;
import smile.anomaly.SVM;
import smile.math.kernel.MercerKernel;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * One-class SVM over scaled window features. The scaler is fit on every training window, the
 * boundary only on windows whose samples are all normal.
 */
@Slf4j
public class OneClassSvmModel implements NoveltyModel {

    private static final int MIN_TRAINING_ROWS = 2;

    private final KernelType kernel;
    private final GammaSetting gamma;
    private final double nu;
    private final double tolerance;

    private volatile NoveltyModelState state;

    public OneClassSvmModel(AnalysisConfig config) {
        this(config.getKernel(), config.getGamma(), config.getNu(), config.getTolerance());
    }

    public OneClassSvmModel(KernelType kernel, GammaSetting gamma, double nu, double tolerance) {
        this.kernel = kernel;
        this.gamma = gamma;
        this.nu = nu;
        this.tolerance = tolerance;
    }

    public static OneClassSvmModel restore(NoveltyModelState state, double tolerance) {
        OneClassSvmModel model = new OneClassSvmModel(state.getKernel(), state.getGamma(), state.getNu(), tolerance);
        model.state = state;
        return model;
    }

    @Override
    public void train(List<LabeledWindow> windows) {
        if (windows.isEmpty()) {
            throw new InsufficientDataException("No windows to train on");
        }
        double[][] features = windows.stream().map(w -> w.getFeatures().toVector()).toArray(double[][]::new);
        FeatureScaler scaler = FeatureScaler.fit(features);

        double[][] normal = IntStream.range(0, windows.size())
                .filter(i -> windows.get(i).isAllNormal())
                .mapToObj(i -> scaler.transform(features[i]))
                .toArray(double[][]::new);
        if (normal.length < MIN_TRAINING_ROWS) {
            throw new InsufficientDataException("Need at least " + MIN_TRAINING_ROWS
                    + " all-normal windows to train, got " + normal.length);
        }

        double resolvedGamma = gamma.resolve(scaler.dimension(), variance(normal));
        MercerKernel<double[]> mercerKernel = KernelFactory.create(kernel, resolvedGamma);
        log.info("Training one-class SVM on {} of {} windows, {} features (kernel={}, gamma={}, nu={})",
                normal.length, windows.size(), scaler.dimension(), kernel.label(), resolvedGamma, nu);

        SVM<double[]> boundary = SVM.fit(normal, mercerKernel, nu, tolerance);
        double orientation = orientation(boundary, normal);
        state = new NoveltyModelState(kernel, gamma, resolvedGamma, nu, scaler, boundary, orientation, normal.length);
        log.info("One-class SVM trained");
    }

    @Override
    public boolean isTrained() {
        return state != null;
    }

    @Override
    public double[] score(List<LabeledWindow> windows) {
        NoveltyModelState current = requireTrained();
        return windows.parallelStream()
                .mapToDouble(w -> current.getOrientation()
                        * current.getBoundary().score(current.getScaler().transform(w.getFeatures().toVector())))
                .toArray();
    }

    @Override
    public boolean[] predict(List<LabeledWindow> windows) {
        double[] scores = score(windows);
        boolean[] outliers = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            outliers[i] = scores[i] < 0;
        }
        return outliers;
    }

    @Override
    public EvaluationReport evaluate(List<LabeledWindow> windows) {
        requireTrained();
        EvaluationReport report = NoveltyModel.super.evaluate(windows);
        log.info("Window evaluation: precision={}, recall={}, f1={}, windows={}, predicted={}, actual={}",
                report.getPrecision(), report.getRecall(), report.getF1(), report.getTotalWindows(),
                report.getPredictedAnomalies(), report.getTrueAnomalies());
        return report;
    }

    public NoveltyModelState state() {
        return requireTrained();
    }

    private NoveltyModelState requireTrained() {
        NoveltyModelState current = state;
        if (current == null) {
            throw new UntrainedModelException("Novelty model must be trained before scoring");
        }
        return current;
    }

    /**
     * Sign that makes the decision value non-negative inside the boundary: at most a nu share of
     * the training rows may fall outside, so the majority of them must score as inliers.
     */
    private static double orientation(SVM<double[]> boundary, double[][] training) {
        long nonNegative = Arrays.stream(training).filter(x -> boundary.score(x) >= 0).count();
        if (2 * nonNegative >= training.length) {
            return 1.0;
        }
        log.debug("Decision values are negative inside the boundary, flipping their sign");
        return -1.0;
    }

    private static double variance(double[][] rows) {
        double sum = 0.0;
        double sumSquares = 0.0;
        long count = 0;
        for (double[] row : rows) {
            for (double v : row) {
                sum += v;
                sumSquares += v * v;
                count++;
            }
        }
        double mean = sum / count;
        return Math.max(0.0, sumSquares / count - mean * mean);
    }
}
