package com.motaz.pipeline.analysis.exception;

/**
 * A model was used before a successful fit.
 */
public class UntrainedModelException extends AnalysisException {

    public UntrainedModelException(String message) {
        super(message);
    }
}
