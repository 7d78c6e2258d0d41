package com.ventture.credit.service.features.providers;

import com.ventture.credit.controller.dto.SimulationRequest;
import com.ventture.credit.service.features.FeatureProvider;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.*;

import static com.ventture.credit.service.features.CreditFeatures.*;

@Component
@Order(1)
public class ApplicantFeaturesProvider implements FeatureProvider {

    @Override
    public Map<String, Double> compute(SimulationRequest in) {
        Map<String, Double> f = new LinkedHashMap<>();
        if (in.income != null) f.put(INCOME, in.income);
        if (in.age != null) f.put(AGE, in.age.doubleValue());
        if (in.income != null && in.age != null) {
            f.put(INCOME_PER_AGE, in.income / (in.age + 1));
        }
        return f;
    }
}
