package com.ventture.credit.controller;

import com.ventture.credit.controller.dto.EvaluationRequest;
import com.ventture.credit.controller.dto.ReasonDtos;
import com.ventture.credit.controller.dto.SimulationRequest;
import com.ventture.credit.engine.report.DecisionReport;
import com.ventture.credit.service.CreditEvaluationService;
import com.ventture.credit.service.ReasonService;
import jakarta.validation.Valid;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@Tag(name = "credit")
@RestController
@RequestMapping("/api/credit")
@RequiredArgsConstructor
public class CreditController {

    private final CreditEvaluationService evaluations;
    private final ReasonService reasons;

    /** Evaluate model features supplied directly by the caller */
    @PostMapping(value = "/evaluate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public DecisionReport evaluate(@Valid @RequestBody EvaluationRequest req) {
        return evaluations.evaluate(req.features);
    }

    /** Simulator form -> derived features -> report (recorded in history) */
    @PostMapping(value = "/simulate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public DecisionReport simulate(@Valid @RequestBody SimulationRequest req) {
        return evaluations.simulate(req);
    }

    @PostMapping(value = "/reasons", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ReasonDtos.ReasonsResponse reasons(@Valid @RequestBody SimulationRequest req,
                                              @RequestParam(defaultValue = "3") int topK,
                                              @RequestParam(defaultValue = "pt") String locale) {
        return reasons.reasons(evaluations.explain(req), topK, locale);
    }
}
