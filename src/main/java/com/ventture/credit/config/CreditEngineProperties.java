package com.ventture.credit.config;

import com.ventture.credit.engine.explain.ExplanationMethod;
import com.ventture.credit.engine.model.DecisionModel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "credit.engine")
public class CreditEngineProperties {

    /** Spring resource location of the model artifact. */
    private String modelLocation = "classpath:model/credit-model.json";

    /** Spring resource location of the fitted feature schema; always loaded together with the model. */
    private String schemaLocation = "classpath:model/feature-schema.json";

    private double threshold = DecisionModel.DEFAULT_THRESHOLD;

    /** Probability above the threshold from which an approval counts as LOW risk. */
    private double reviewMargin = DecisionModel.DEFAULT_REVIEW_MARGIN;

    private Explanation explanation = new Explanation();

    @Data
    public static class Explanation {
        private ExplanationMethod method = ExplanationMethod.AUTO;
        private int maxPerturbationFeatures = 64;
        private Duration timeout = Duration.ofSeconds(2);
    }
}
