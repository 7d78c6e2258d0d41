package com.ventture.credit.engine.model;

import com.ventture.credit.engine.NormalizedVector;

import java.util.List;

/** Logistic regression: {@code sigmoid(w . x + b)}. */
public final class LinearScoringModel implements ScoringModel, WeightedModel {

    private final String version;
    private final double[] coefficients;
    private final double intercept;
    private final List<String> featureNames;

    public LinearScoringModel(String version, double[] coefficients, double intercept, List<String> featureNames) {
        if (coefficients == null || coefficients.length == 0) {
            throw new IllegalArgumentException("linear model needs at least one coefficient");
        }
        for (double c : coefficients) {
            if (!Double.isFinite(c)) throw new IllegalArgumentException("non-finite coefficient " + c);
        }
        if (!Double.isFinite(intercept)) {
            throw new IllegalArgumentException("non-finite intercept " + intercept);
        }
        if (featureNames != null && !featureNames.isEmpty() && featureNames.size() != coefficients.length) {
            throw new IllegalArgumentException("linear model declares " + featureNames.size()
                    + " feature names for " + coefficients.length + " coefficients");
        }
        this.version = version == null ? "unversioned" : version;
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
        this.featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
    }

    public LinearScoringModel(double[] coefficients, double intercept) {
        this(null, coefficients, intercept, null);
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public int featureCount() {
        return coefficients.length;
    }

    @Override
    public List<String> featureNames() {
        return featureNames;
    }

    @Override
    public double coefficient(int featureIndex) {
        return coefficients[featureIndex];
    }

    @Override
    public double logit(NormalizedVector vector) {
        double z = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            z += coefficients[i] * vector.get(i);
        }
        return z;
    }

    @Override
    public double score(NormalizedVector vector) {
        return sigmoid(logit(vector));
    }

    public static double sigmoid(double z) {
        // split keeps exp() from overflowing for large |z|
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }
}
