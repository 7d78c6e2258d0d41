package com.ventture.credit.engine.explain;

import java.util.Comparator;

/**
 * Signed effect of one feature on the model output relative to the baseline.
 *
 * @param index      position of the feature in the schema
 * @param degenerate the feature had zero fitted variance; its score is forced to 0
 */
public record Contribution(String feature, int index, double normalizedValue, double score, boolean degenerate) {

    /** Descending absolute score, ties by ascending schema index. */
    public static final Comparator<Contribution> RANKING =
            Comparator.comparingDouble(Contribution::absScore).reversed()
                    .thenComparingInt(Contribution::index);

    public double absScore() {
        return Math.abs(score);
    }

    /** "pos" when the feature pushes towards approval, "neg" against it, "none" when it has no effect. */
    public String direction() {
        if (degenerate || score == 0.0) return "none";
        return score > 0 ? "pos" : "neg";
    }
}
