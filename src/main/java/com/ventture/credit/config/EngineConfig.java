package com.ventture.credit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ventture.credit.engine.artifact.ArtifactLoader;
import com.ventture.credit.engine.explain.ExplanationEngine;
import com.ventture.credit.engine.model.DecisionModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    @Bean
    public ArtifactLoader artifactLoader(ObjectMapper objectMapper) {
        return new ArtifactLoader(objectMapper);
    }

    @Bean
    public DecisionModel decisionModel(CreditEngineProperties props) {
        return new DecisionModel(props.getThreshold(), props.getReviewMargin());
    }

    @Bean
    public ExplanationEngine explanationEngine(CreditEngineProperties props) {
        var e = props.getExplanation();
        return new ExplanationEngine(e.getMethod(), e.getMaxPerturbationFeatures(), e.getTimeout());
    }
}
