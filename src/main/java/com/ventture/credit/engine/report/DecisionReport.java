package com.ventture.credit.engine.report;

import com.ventture.credit.engine.explain.Contribution;
import com.ventture.credit.engine.explain.ExplanationMethod;
import com.ventture.credit.engine.model.Prediction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one evaluation, ready for rendering. Contributions are ordered by descending
 * absolute score; {@code rawInput} echoes the values before normalization.
 */
public record DecisionReport(
        Prediction prediction,
        List<Contribution> contributions,
        Map<String, Double> rawInput,
        ExplanationMethod explanationMethod,
        List<String> flaggedFeatures,
        String modelVersion,
        String schemaVersion
) {

    public DecisionReport {
        contributions = List.copyOf(contributions);
        rawInput = Collections.unmodifiableMap(new LinkedHashMap<>(rawInput));
        flaggedFeatures = List.copyOf(flaggedFeatures);
    }

    public List<Contribution> top(int k) {
        return contributions.subList(0, Math.min(Math.max(k, 0), contributions.size()));
    }
}
