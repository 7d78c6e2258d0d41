package com.ventture.credit.controller.dto;

import java.util.List;

public final class ReasonDtos {
    private ReasonDtos() {}

    public static class Reason {
        public String feature;
        public Double value;       // raw value as submitted
        public double contribution; // signed
        public double absContribution;
        public String direction;   // "pos" (towards approval) / "neg" / "none"
        public String title;
        public String text;
    }

    public static class ReasonsResponse {
        public String decision;
        public Double probability;
        public Double threshold;
        public String riskTier;
        public String method;
        public List<Reason> reasons;
    }
}
