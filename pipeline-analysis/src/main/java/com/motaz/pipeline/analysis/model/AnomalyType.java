package com.motaz.pipeline.analysis.model;

import java.util.Locale;

/**
 * Ground-truth origin of a sample. Only used for evaluation and attribution.
 */
public enum AnomalyType {
    NORMAL,
    LEAK,
    OPERATIONAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
