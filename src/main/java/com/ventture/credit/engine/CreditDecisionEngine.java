package com.ventture.credit.engine;

import com.ventture.credit.engine.artifact.ModelBundle;
import com.ventture.credit.engine.error.ExplanationException;
import com.ventture.credit.engine.explain.Explanation;
import com.ventture.credit.engine.explain.ExplanationEngine;
import com.ventture.credit.engine.model.DecisionModel;
import com.ventture.credit.engine.model.Prediction;
import com.ventture.credit.engine.report.DecisionReport;
import com.ventture.credit.engine.report.DecisionReportAssembler;

/**
 * normalize -> predict -> explain -> assemble, for one application.
 *
 * <p>Immutable once built; one instance serves any number of concurrent evaluations.
 * Every stage of a call sees the same bundle, so the explanation always matches the prediction.
 */
public final class CreditDecisionEngine {

    private final ModelBundle bundle;
    private final NormalizedVector baseline;
    private final FeatureNormalizer normalizer;
    private final DecisionModel decisionModel;
    private final ExplanationEngine explanationEngine;
    private final DecisionReportAssembler assembler;

    public CreditDecisionEngine(ModelBundle bundle, DecisionModel decisionModel, ExplanationEngine explanationEngine) {
        this.bundle = bundle;
        this.baseline = bundle.schema().baseline();
        this.normalizer = new FeatureNormalizer();
        this.decisionModel = decisionModel;
        this.explanationEngine = explanationEngine;
        this.assembler = new DecisionReportAssembler();
    }

    public ModelBundle bundle() {
        return bundle;
    }

    public double threshold() {
        return decisionModel.threshold();
    }

    /**
     * Full report. When the output cannot be explained the {@link ExplanationException} carries the
     * prediction that was already made.
     */
    public DecisionReport evaluate(ApplicationInput input) {
        FeatureSchema schema = bundle.schema();
        NormalizedVector vector = normalizer.normalize(input, schema);
        Prediction prediction = decisionModel.predict(vector, bundle.model());
        Explanation explanation;
        try {
            explanation = explanationEngine.explain(bundle.model(), vector, schema.featureNames(), baseline);
        } catch (ExplanationException e) {
            throw e.withPrediction(prediction);
        }
        return assembler.assemble(input, prediction, explanation, bundle.model().version(), schema.version());
    }

    /** Decision only, without explanation. */
    public Prediction predict(ApplicationInput input) {
        return decisionModel.predict(normalizer.normalize(input, bundle.schema()), bundle.model());
    }
}
