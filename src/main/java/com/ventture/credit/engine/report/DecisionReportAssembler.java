package com.ventture.credit.engine.report;

import com.ventture.credit.engine.ApplicationInput;
import com.ventture.credit.engine.explain.Contribution;
import com.ventture.credit.engine.explain.Explanation;
import com.ventture.credit.engine.model.Prediction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class DecisionReportAssembler {

    public DecisionReport assemble(ApplicationInput input, Prediction prediction, Explanation explanation,
                                   String modelVersion, String schemaVersion) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(prediction, "prediction");
        Objects.requireNonNull(explanation, "explanation");
        Objects.requireNonNull(modelVersion, "modelVersion");
        Objects.requireNonNull(schemaVersion, "schemaVersion");

        List<Contribution> ranked = new ArrayList<>(explanation.contributions());
        ranked.sort(Contribution.RANKING);
        return new DecisionReport(prediction, ranked, input.values(), explanation.method(),
                explanation.flaggedFeatures(), modelVersion, schemaVersion);
    }
}
