package com.motaz.pipeline.analysis.exception;

/**
 * Not enough samples or windows to run a stage.
 */
public class InsufficientDataException extends AnalysisException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
