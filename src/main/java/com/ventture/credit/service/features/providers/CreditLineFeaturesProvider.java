package com.ventture.credit.service.features.providers;

import com.ventture.credit.controller.dto.SimulationRequest;
import com.ventture.credit.service.features.FeatureProvider;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.*;

import static com.ventture.credit.service.features.CreditFeatures.CREDIT_AMOUNT;

@Component
@Order(2)
public class CreditLineFeaturesProvider implements FeatureProvider {

    @Override
    public Map<String, Double> compute(SimulationRequest in) {
        Map<String, Double> f = new LinkedHashMap<>();
        if (in.creditAmount != null) f.put(CREDIT_AMOUNT, in.creditAmount);
        return f;
    }
}
