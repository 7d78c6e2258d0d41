package com.ventture.credit.engine.explain;

import java.util.List;

/**
 * Ranked contributions together with the outputs they decompose.
 * For {@link ExplanationMethod#ANALYTIC} the scores are log-odds, for
 * {@link ExplanationMethod#PERTURBATION} probabilities.
 *
 * @param method          method actually applied (never AUTO)
 * @param outputScore     model output for the application
 * @param baselineScore   model output for the baseline vector
 * @param flaggedFeatures zero-variance features whose contribution was forced to 0
 */
public record Explanation(
        ExplanationMethod method,
        List<Contribution> contributions,
        double outputScore,
        double baselineScore,
        List<String> flaggedFeatures
) {

    public Explanation {
        contributions = List.copyOf(contributions);
        flaggedFeatures = List.copyOf(flaggedFeatures);
    }

    public double total() {
        double sum = 0.0;
        for (Contribution c : contributions) sum += c.score();
        return sum;
    }
}
