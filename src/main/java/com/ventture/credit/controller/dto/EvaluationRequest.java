package com.ventture.credit.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.util.Map;

/** Raw feature values keyed by model feature name. */
public class EvaluationRequest {
    @NotNull
    public Map<String, Double> features;
}
