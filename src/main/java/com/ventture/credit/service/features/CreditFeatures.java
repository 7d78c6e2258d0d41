package com.ventture.credit.service.features;

/** Model feature names, in the order the shipped model was trained on. */
public final class CreditFeatures {
    private CreditFeatures() {}

    public static final String INCOME = "income";
    public static final String AGE = "age";
    public static final String CREDIT_AMOUNT = "credit_amount";
    public static final String GUARANTEE_VALUE = "guarantee_value";
    public static final String GUARANTEE_CREDIT_RATIO = "guarantee_credit_ratio";
    public static final String LIQUIDITY_SCORE = "liquidity_score";
    public static final String INCOME_PER_AGE = "income_per_age";
    public static final String WEIGHTED_GUARANTEE = "weighted_guarantee";
}
