package com.motaz.pipeline.analysis.exception;

/**
 * Base type for failures raised by the analysis stages.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
