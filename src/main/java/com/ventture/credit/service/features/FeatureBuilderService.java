package com.ventture.credit.service.features;

import com.ventture.credit.controller.dto.SimulationRequest;
import com.ventture.credit.engine.ApplicationInput;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Merges the output of every provider into one application input. */
@Service
@RequiredArgsConstructor
public class FeatureBuilderService {

    private final List<FeatureProvider> providers;

    public ApplicationInput build(SimulationRequest input) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (input != null) {
            for (FeatureProvider p : providers) {
                out.putAll(p.compute(input));
            }
        }
        return ApplicationInput.of(out);
    }
}
