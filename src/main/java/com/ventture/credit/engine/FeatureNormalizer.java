package com.ventture.credit.engine;

import com.ventture.credit.engine.error.InvalidValueException;
import com.ventture.credit.engine.error.MissingFeatureException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates raw input against the schema and applies the fitted scaling.
 * Stateless; safe to share between threads.
 */
public class FeatureNormalizer {

    public NormalizedVector normalize(ApplicationInput input, FeatureSchema schema) {
        List<String> missing = new ArrayList<>();
        for (FeatureSpec f : schema.features()) {
            if (!input.has(f.name())) missing.add(f.name());
        }
        if (!missing.isEmpty()) {
            throw new MissingFeatureException(missing);
        }

        double[] out = new double[schema.size()];
        Set<Integer> degenerate = new HashSet<>();
        for (int i = 0; i < schema.size(); i++) {
            FeatureSpec f = schema.feature(i);
            double raw = input.get(f.name());
            check(f, raw);
            if (f.isDegenerate()) degenerate.add(i);
            out[i] = f.normalize(raw);
        }
        return NormalizedVector.of(out, degenerate);
    }

    private void check(FeatureSpec f, double raw) {
        if (!Double.isFinite(raw)) {
            throw new InvalidValueException(f.name(), "Feature '" + f.name() + "' is not a finite number: " + raw);
        }
        if (f.lowerBound() != null && raw < f.lowerBound()) {
            throw new InvalidValueException(f.name(),
                    "Feature '" + f.name() + "' = " + raw + " is below the minimum " + f.lowerBound());
        }
        if (f.upperBound() != null && raw > f.upperBound()) {
            throw new InvalidValueException(f.name(),
                    "Feature '" + f.name() + "' = " + raw + " is above the maximum " + f.upperBound());
        }
    }
}
