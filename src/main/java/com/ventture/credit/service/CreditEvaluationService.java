package com.ventture.credit.service;

import com.ventture.credit.controller.dto.SimulationRequest;
import com.ventture.credit.engine.ApplicationInput;
import com.ventture.credit.engine.report.DecisionReport;
import com.ventture.credit.service.features.FeatureBuilderService;
import com.ventture.credit.service.features.Liquidity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class CreditEvaluationService {

    private final EngineRegistry engines;
    private final FeatureBuilderService featureBuilder;
    private final HistoryService history;

    /** Evaluates already-computed model features. */
    public DecisionReport evaluate(Map<String, Double> features) {
        DecisionReport report = engines.current().evaluate(ApplicationInput.of(features));
        log.debug("Evaluated features -> {} p={}", report.prediction().label(), report.prediction().probability());
        history.record(report, null);
        return report;
    }

    /** Derives the model features from the simulator form, evaluates and records the result. */
    public DecisionReport simulate(SimulationRequest request) {
        DecisionReport report = explain(request);
        Liquidity liquidity = Liquidity.parse(request.liquidity);
        history.record(report, liquidity == null ? null : liquidity.name().toLowerCase(Locale.ROOT));
        log.info("Simulation {} p={} tier={} model={}",
                report.prediction().label(), String.format(Locale.ROOT, "%.4f", report.prediction().probability()),
                report.prediction().riskTier(), report.modelVersion());
        return report;
    }

    /** Same evaluation as {@link #simulate} without recording history. */
    public DecisionReport explain(SimulationRequest request) {
        ApplicationInput input = featureBuilder.build(request);
        return engines.current().evaluate(input);
    }
}
