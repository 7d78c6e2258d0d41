package com.ventture.credit.engine.model;

import com.ventture.credit.engine.NormalizedVector;

/**
 * Capability of models whose log-odds are linear in the features, which allows
 * exact additive attribution.
 */
public interface WeightedModel {

    double coefficient(int featureIndex);

    /** Log-odds before the sigmoid. */
    double logit(NormalizedVector vector);
}
