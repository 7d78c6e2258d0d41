package com.ventture.credit.controller.dto;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * Simulator form. Fields are nullable on purpose: an absent field surfaces as a missing
 * model feature rather than being defaulted.
 */
public class SimulationRequest {
    @PositiveOrZero
    public Double  income;          // monthly income
    @PositiveOrZero
    public Integer age;
    @PositiveOrZero
    public Double  creditAmount;    // requested amount
    @PositiveOrZero
    public Double  guaranteeValue;
    public String  liquidity;       // "low" | "medium" | "high" (also "baixa" | "media" | "alta")
}
