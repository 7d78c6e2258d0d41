package com.ventture.credit.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered feature list with fitted statistics. The order is the order the model was trained on.
 */
public final class FeatureSchema {

    private final String version;
    private final ScalingMethod scaling;
    private final List<FeatureSpec> features;

    public FeatureSchema(String version, ScalingMethod scaling, List<FeatureSpec> features) {
        Objects.requireNonNull(features, "features");
        if (features.isEmpty()) {
            throw new IllegalArgumentException("schema must declare at least one feature");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < features.size(); i++) {
            FeatureSpec f = features.get(i);
            if (f.name() == null || f.name().isBlank()) {
                throw new IllegalArgumentException("feature #" + i + " has no name");
            }
            if (f.scale() < 0 || !Double.isFinite(f.scale()) || !Double.isFinite(f.center())) {
                throw new IllegalArgumentException("feature '" + f.name() + "' has invalid center/scale");
            }
            if (!seen.add(f.name())) {
                throw new IllegalArgumentException("duplicate feature '" + f.name() + "'");
            }
        }
        this.version = version == null ? "unversioned" : version;
        this.scaling = scaling == null ? ScalingMethod.STANDARD : scaling;
        this.features = List.copyOf(features);
    }

    public String version() {
        return version;
    }

    public ScalingMethod scaling() {
        return scaling;
    }

    public List<FeatureSpec> features() {
        return features;
    }

    public int size() {
        return features.size();
    }

    public FeatureSpec feature(int index) {
        return features.get(index);
    }

    public List<String> featureNames() {
        List<String> names = new ArrayList<>(features.size());
        for (FeatureSpec f : features) names.add(f.name());
        return names;
    }

    /** Baseline (mean application by default) expressed in normalized space. */
    public NormalizedVector baseline() {
        double[] base = new double[features.size()];
        for (int i = 0; i < base.length; i++) {
            base[i] = features.get(i).normalizedBaseline();
        }
        return NormalizedVector.of(base);
    }
}
