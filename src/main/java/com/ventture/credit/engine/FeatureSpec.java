package com.ventture.credit.engine;

/**
 * One schema entry: fitted normalization parameters plus optional validation bounds
 * on the raw value. {@code baseline} is the raw reference value explanations are measured against.
 */
public record FeatureSpec(
        String name,
        double center,
        double scale,
        double baseline,
        Double lowerBound,
        Double upperBound
) {

    public static FeatureSpec of(String name, double center, double scale) {
        return new FeatureSpec(name, center, scale, center, null, null);
    }

    public boolean isDegenerate() {
        return scale == 0.0;
    }

    public double normalize(double raw) {
        if (isDegenerate()) return 0.0;
        return (raw - center) / scale;
    }

    public double normalizedBaseline() {
        return normalize(baseline);
    }
}
