package com.motaz.pipeline.analysis.config;

import com.motaz.pipeline.analysis.exception.ConfigurationException;

import java.util.Locale;

/**
 * Merge cost between clusters. WARD is the minimum-variance criterion.
 */
public enum LinkageType {
    WARD("ward"),
    COMPLETE("complete"),
    AVERAGE("average"),
    SINGLE("single");

    private final String label;

    LinkageType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static LinkageType fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (LinkageType type : values()) {
                if (type.label.equals(key)) {
                    return type;
                }
            }
        }
        throw new ConfigurationException("Unknown linkage: " + name);
    }
}
