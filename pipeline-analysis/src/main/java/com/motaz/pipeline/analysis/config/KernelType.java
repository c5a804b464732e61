package com.motaz.pipeline.analysis.config;

import com.motaz.pipeline.analysis.exception.ConfigurationException;

import java.util.Locale;

public enum KernelType {
    RBF("rbf"),
    LINEAR("linear"),
    POLY("poly"),
    SIGMOID("sigmoid");

    private final String label;

    KernelType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static KernelType fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (KernelType type : values()) {
                if (type.label.equals(key)) {
                    return type;
                }
            }
        }
        throw new ConfigurationException("Unknown kernel: " + name);
    }
}
