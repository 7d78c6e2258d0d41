package com.ventture.credit.engine;

import java.util.Locale;

/** How the fitted statistics of a schema were produced. Both apply {@code (raw - center) / scale}. */
public enum ScalingMethod {
    /** center = mean, scale = standard deviation */
    STANDARD,
    /** center = min, scale = max - min */
    MIN_MAX;

    public static ScalingMethod parse(String value) {
        if (value == null || value.isBlank()) return STANDARD;
        return ScalingMethod.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
