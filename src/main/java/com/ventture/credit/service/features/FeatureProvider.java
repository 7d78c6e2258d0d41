package com.ventture.credit.service.features;

import com.ventture.credit.controller.dto.SimulationRequest;
import java.util.Map;

/**
 * Computes one group of model features from the simulator form. A provider leaves out any feature
 * whose inputs are absent; the normalizer then reports it as missing.
 */
public interface FeatureProvider {

    Map<String, Double> compute(SimulationRequest input);
}
