package com.ventture.credit.engine.model;

/**
 * @param probability positive-class (approval) probability in [0, 1]
 * @param threshold   cut-off the label was derived with
 */
public record Prediction(Decision label, double probability, double threshold, RiskTier riskTier) {

    public boolean approved() {
        return label == Decision.APPROVED;
    }
}
