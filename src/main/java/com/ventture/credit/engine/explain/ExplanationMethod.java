package com.ventture.credit.engine.explain;

public enum ExplanationMethod {
    /** Analytic when the model exposes weights, perturbation otherwise. */
    AUTO,
    /** coefficient x (value - baseline) in log-odds space; linear models only */
    ANALYTIC,
    /** rescore with each feature reset to baseline; any model */
    PERTURBATION
}
