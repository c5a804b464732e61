package com.motaz.pipeline.exception;

public class AnalysisAlreadyRunningException extends RuntimeException {

    public AnalysisAlreadyRunningException(String jobId) {
        super("Analysis " + jobId + " is already running");
    }
}
