package com.ventture.credit.controller;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.aMapWithSize;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CreditApiIntegrationTest {

    private static final String FORM = """
            {"income": 8000, "age": 35, "creditAmount": 50000, "guaranteeValue": 80000, "liquidity": "media"}
            """;

    @Autowired
    private MockMvc mvc;

    @BeforeEach
    void clearHistory() throws Exception {
        mvc.perform(delete("/api/history")).andExpect(status().isOk());
    }

    @Nested
    @DisplayName("POST /api/credit/simulate")
    class Simulate {

        @Test
        @DisplayName("returns a full report and records it")
        void fullReport() throws Exception {
            mvc.perform(post("/api/credit/simulate").contentType(MediaType.APPLICATION_JSON).content(FORM))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.prediction.label").exists())
                    .andExpect(jsonPath("$.prediction.threshold", is(0.5)))
                    .andExpect(jsonPath("$.contributions", hasSize(8)))
                    .andExpect(jsonPath("$.rawInput.income", is(8000.0)))
                    .andExpect(jsonPath("$.rawInput.liquidity_score", is(2.0)))
                    .andExpect(jsonPath("$.explanationMethod", is("ANALYTIC")))
                    .andExpect(jsonPath("$.modelVersion", is("logreg-2024.10")));

            mvc.perform(get("/api/history"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(1)))
                    .andExpect(jsonPath("$[0].liquidity", is("medium")));
        }

        @Test
        @DisplayName("a missing field is a 422 naming the feature")
        void missingField() throws Exception {
            mvc.perform(post("/api/credit/simulate").contentType(MediaType.APPLICATION_JSON)
                            .content("{\"income\": 8000, \"age\": 35, \"guaranteeValue\": 80000, \"liquidity\": \"alta\"}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.missingFeatures",
                            contains("credit_amount", "guarantee_credit_ratio", "weighted_guarantee")));

            mvc.perform(get("/api/history")).andExpect(jsonPath("$", hasSize(0)));
        }

        @Test
        @DisplayName("negative amounts are rejected by validation")
        void negative() throws Exception {
            mvc.perform(post("/api/credit/simulate").contentType(MediaType.APPLICATION_JSON)
                            .content("{\"income\": -1, \"age\": 35, \"creditAmount\": 1, \"guaranteeValue\": 1, \"liquidity\": \"low\"}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("an unknown liquidity level is a 422")
        void badLiquidity() throws Exception {
            mvc.perform(post("/api/credit/simulate").contentType(MediaType.APPLICATION_JSON)
                            .content(FORM.replace("media", "whenever")))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.feature", is("liquidity")));
        }
    }

    @Nested
    @DisplayName("POST /api/credit/evaluate")
    class Evaluate {

        @Test
        @DisplayName("out-of-range age is a 422")
        void outOfRange() throws Exception {
            mvc.perform(post("/api/credit/evaluate").contentType(MediaType.APPLICATION_JSON).content("""
                            {"features": {"income": 8000, "age": 12, "credit_amount": 50000, "guarantee_value": 80000,
                              "guarantee_credit_ratio": 1.6, "liquidity_score": 2, "income_per_age": 615,
                              "weighted_guarantee": 3.2}}
                            """))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.message", containsString("age")));
        }

        @Test
        @DisplayName("features are required")
        void noFeatures() throws Exception {
            mvc.perform(post("/api/credit/evaluate").contentType(MediaType.APPLICATION_JSON).content("{}"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Test
    @DisplayName("POST /api/credit/reasons returns localized reasons without recording history")
    void reasons() throws Exception {
        mvc.perform(post("/api/credit/reasons?topK=2&locale=en").contentType(MediaType.APPLICATION_JSON).content(FORM))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reasons", hasSize(2)))
                .andExpect(jsonPath("$.reasons[0].title").exists())
                .andExpect(jsonPath("$.method", is("ANALYTIC")));

        mvc.perform(get("/api/history")).andExpect(jsonPath("$", hasSize(0)));
    }

    @Nested
    @DisplayName("GET /api/history/summary")
    class Summary {

        // small loan, large liquid guarantee, high income
        private static final String STRONG = """
                {"income": 20000, "age": 40, "creditAmount": 30000, "guaranteeValue": 300000, "liquidity": "high"}
                """;
        // large loan, small illiquid guarantee, low income
        private static final String WEAK = """
                {"income": 2000, "age": 30, "creditAmount": 400000, "guaranteeValue": 10000, "liquidity": "low"}
                """;

        private double simulate(String form, String expectedLabel) throws Exception {
            String body = mvc.perform(post("/api/credit/simulate").contentType(MediaType.APPLICATION_JSON).content(form))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.prediction.label", is(expectedLabel)))
                    .andReturn().getResponse().getContentAsString();
            return JsonPath.<Number>read(body, "$.prediction.probability").doubleValue();
        }

        @Test
        @DisplayName("all figures are zero on an empty history")
        void empty() throws Exception {
            mvc.perform(get("/api/history/summary"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.total", is(0)))
                    .andExpect(jsonPath("$.approvalRate", is(0.0)))
                    .andExpect(jsonPath("$.meanProbability", is(0.0)))
                    .andExpect(jsonPath("$.approvalRateByLiquidity", anEmptyMap()))
                    .andExpect(jsonPath("$.meanProbabilityByCreditBand", anEmptyMap()));
        }

        @Test
        @DisplayName("rates and means follow the recorded decisions")
        void figures() throws Exception {
            double approved = simulate(STRONG, "APPROVED");
            double denied = simulate(WEAK, "DENIED");

            mvc.perform(get("/api/history/summary"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.total", is(2)))
                    .andExpect(jsonPath("$.approvalRate", closeTo(0.5, 1e-9)))
                    .andExpect(jsonPath("$.meanProbability", closeTo((approved + denied) / 2, 1e-9)))
                    .andExpect(jsonPath("$.approvalRateByLiquidity.high", closeTo(1.0, 1e-9)))
                    .andExpect(jsonPath("$.approvalRateByLiquidity.low", closeTo(0.0, 1e-9)))
                    .andExpect(jsonPath("$.approvalRateByLiquidity.medium").doesNotExist())
                    .andExpect(jsonPath("$.meanProbabilityByCreditBand['0-50k']", closeTo(approved, 1e-9)))
                    .andExpect(jsonPath("$.meanProbabilityByCreditBand['300k-500k']", closeTo(denied, 1e-9)))
                    .andExpect(jsonPath("$.meanProbabilityByCreditBand['50k-150k']").doesNotExist());
        }

        @Test
        @DisplayName("evaluations in the same credit band are averaged together")
        void sameBand() throws Exception {
            double first = simulate(STRONG, "APPROVED");
            double second = simulate(STRONG.replace("\"creditAmount\": 30000", "\"creditAmount\": 45000"), "APPROVED");

            mvc.perform(get("/api/history/summary"))
                    .andExpect(jsonPath("$.meanProbabilityByCreditBand", aMapWithSize(1)))
                    .andExpect(jsonPath("$.meanProbabilityByCreditBand['0-50k']", closeTo((first + second) / 2, 1e-9)));
        }
    }

    @Test
    @DisplayName("the scoring API group documents only the credit endpoints")
    void scoringApiGroup() throws Exception {
        mvc.perform(get("/v3/api-docs/scoring"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title", is("Credit Decision API")))
                .andExpect(jsonPath("$.paths['/api/credit/simulate']").exists())
                .andExpect(jsonPath("$.paths['/api/history']").doesNotExist());
    }

    @Test
    @DisplayName("GET /api/model describes the active model and schema")
    void model() throws Exception {
        mvc.perform(get("/api/model"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.modelVersion", is("logreg-2024.10")))
                .andExpect(jsonPath("$.schemaVersion", is("fs-2024.10")))
                .andExpect(jsonPath("$.count", is(8)))
                .andExpect(jsonPath("$.features[0]", is("income")));
    }
}
