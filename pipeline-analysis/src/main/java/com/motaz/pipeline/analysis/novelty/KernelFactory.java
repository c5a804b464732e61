package com.motaz.pipeline.analysis.novelty;

import com.motaz.pipeline.analysis.config.KernelType;
import smile.math.kernel.GaussianKernel;
import smile.math.kernel.HyperbolicTangentKernel;
import smile.math.kernel.LinearKernel;
import smile.math.kernel.MercerKernel;
import smile.math.kernel.PolynomialKernel;

/**
 * Maps a kernel family and a resolved gamma to a Smile kernel.
 */
public final class KernelFactory {

    static final int POLY_DEGREE = 3;

    private KernelFactory() {
    }

    public static MercerKernel<double[]> create(KernelType type, double gamma) {
        return switch (type) {
            // exp(-gamma * |x - y|^2) == exp(-|x - y|^2 / (2 sigma^2))
            case RBF -> new GaussianKernel(Math.sqrt(1.0 / (2.0 * gamma)));
            case LINEAR -> new LinearKernel();
            case POLY -> new PolynomialKernel(POLY_DEGREE, gamma, 0.0);
            case SIGMOID -> new HyperbolicTangentKernel(gamma, 0.0);
        };
    }
}
