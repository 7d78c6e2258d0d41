package com.ventture.credit.engine.model;

import com.ventture.credit.engine.NormalizedVector;

import java.util.List;

/**
 * A trained binary classifier. Implementations are immutable and shared across
 * concurrent evaluations.
 */
public interface ScoringModel {

    String version();

    /** Number of features the model was trained on. */
    int featureCount();

    /** Feature names in training order, or an empty list if the artifact does not record them. */
    List<String> featureNames();

    /**
     * Positive-class (approval) probability. Callers guarantee
     * {@code vector.size() == featureCount()}.
     */
    double score(NormalizedVector vector);
}
