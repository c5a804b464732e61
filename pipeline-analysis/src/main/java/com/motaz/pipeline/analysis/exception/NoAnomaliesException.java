package com.motaz.pipeline.analysis.exception;

/**
 * There were no usable event groups to attribute.
 */
public class NoAnomaliesException extends AnalysisException {

    public NoAnomaliesException(String message) {
        super(message);
    }
}
