package com.motaz.pipeline.analysis.exception;

/**
 * Invalid or inconsistent configuration, raised before any computation starts.
 */
public class ConfigurationException extends AnalysisException {

    public ConfigurationException(String message) {
        super(message);
    }
}
