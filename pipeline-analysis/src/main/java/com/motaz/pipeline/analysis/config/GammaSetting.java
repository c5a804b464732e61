package com.motaz.pipeline.analysis.config;

import com.motaz.pipeline.analysis.exception.ConfigurationException;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.Locale;

/**
 * Kernel width: {@code auto} (1 / dimension), {@code scale} (1 / (dimension * variance)) or a fixed value.
 */
@EqualsAndHashCode
public final class GammaSetting implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final GammaSetting AUTO = new GammaSetting("auto", Double.NaN);
    public static final GammaSetting SCALE = new GammaSetting("scale", Double.NaN);

    private final String mode;
    private final double value;

    private GammaSetting(String mode, double value) {
        this.mode = mode;
        this.value = value;
    }

    public static GammaSetting of(double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new ConfigurationException("gamma must be a positive number, got " + value);
        }
        return new GammaSetting("fixed", value);
    }

    public static GammaSetting parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("gamma must not be blank");
        }
        String key = text.trim().toLowerCase(Locale.ROOT);
        if (AUTO.mode.equals(key)) {
            return AUTO;
        }
        if (SCALE.mode.equals(key)) {
            return SCALE;
        }
        try {
            return of(Double.parseDouble(key));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("gamma must be 'auto', 'scale' or a number, got " + text);
        }
    }

    /**
     * @param dimension    feature dimension
     * @param dataVariance variance of all scaled training entries
     */
    public double resolve(int dimension, double dataVariance) {
        return switch (mode) {
            case "auto" -> 1.0 / dimension;
            case "scale" -> dataVariance > 0 ? 1.0 / (dimension * dataVariance) : 1.0;
            default -> value;
        };
    }

    @Override
    public String toString() {
        return "fixed".equals(mode) ? Double.toString(value) : mode;
    }
}
