package com.ventture.credit.engine.model;

/** Ordinal risk band derived from the approval probability. */
public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH
}
