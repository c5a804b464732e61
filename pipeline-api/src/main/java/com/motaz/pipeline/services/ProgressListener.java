package com.motaz.pipeline.services;

@FunctionalInterface
public interface ProgressListener {

    /**
     * Reports that the run reached {@code progress} percent inside {@code stage}.
     */
    void checkpoint(String stage, int progress);
}
