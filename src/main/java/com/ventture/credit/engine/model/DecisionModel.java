package com.ventture.credit.engine.model;

import com.ventture.credit.engine.NormalizedVector;
import com.ventture.credit.engine.error.CreditEngineException;
import com.ventture.credit.engine.error.DimensionMismatchException;

/**
 * Turns a model score into a labelled {@link Prediction}.
 * Approved when {@code probability >= threshold}; risk tier LOW from
 * {@code threshold + reviewMargin} upwards, MEDIUM between, HIGH below the threshold.
 */
public class DecisionModel {

    public static final double DEFAULT_THRESHOLD = 0.5;
    public static final double DEFAULT_REVIEW_MARGIN = 0.15;

    private final double threshold;
    private final double reviewMargin;

    public DecisionModel(double threshold, double reviewMargin) {
        if (!(threshold > 0.0 && threshold < 1.0)) {
            throw new IllegalArgumentException("threshold must be in (0,1): " + threshold);
        }
        if (!(reviewMargin >= 0.0)) {
            throw new IllegalArgumentException("reviewMargin must be >= 0: " + reviewMargin);
        }
        this.threshold = threshold;
        this.reviewMargin = reviewMargin;
    }

    public DecisionModel() {
        this(DEFAULT_THRESHOLD, DEFAULT_REVIEW_MARGIN);
    }

    public double threshold() {
        return threshold;
    }

    public Prediction predict(NormalizedVector vector, ScoringModel model) {
        if (vector.size() != model.featureCount()) {
            throw new DimensionMismatchException(model.featureCount(), vector.size());
        }
        double p = model.score(vector);
        if (!(p >= 0.0 && p <= 1.0)) {
            throw new CreditEngineException("Model " + model.version() + " produced an invalid probability: " + p);
        }
        Decision label = p >= threshold ? Decision.APPROVED : Decision.DENIED;
        return new Prediction(label, p, threshold, tier(p));
    }

    private RiskTier tier(double p) {
        if (p >= threshold + reviewMargin) return RiskTier.LOW;
        if (p >= threshold) return RiskTier.MEDIUM;
        return RiskTier.HIGH;
    }
}
