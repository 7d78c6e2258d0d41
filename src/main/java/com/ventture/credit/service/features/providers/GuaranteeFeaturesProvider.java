package com.ventture.credit.service.features.providers;

import com.ventture.credit.controller.dto.SimulationRequest;
import com.ventture.credit.service.features.FeatureProvider;
import com.ventture.credit.service.features.Liquidity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.*;

import static com.ventture.credit.service.features.CreditFeatures.*;

/**
 * Guarantee coverage: {@code ratio = value / (credit + 1)} and the same ratio weighted by liquidity.
 */
@Component
@Order(3)
public class GuaranteeFeaturesProvider implements FeatureProvider {

    @Override
    public Map<String, Double> compute(SimulationRequest in) {
        Map<String, Double> f = new LinkedHashMap<>();
        Liquidity liquidity = Liquidity.parse(in.liquidity);
        if (in.guaranteeValue != null) f.put(GUARANTEE_VALUE, in.guaranteeValue);
        if (liquidity != null) f.put(LIQUIDITY_SCORE, (double) liquidity.score());

        if (in.guaranteeValue != null && in.creditAmount != null) {
            double ratio = in.guaranteeValue / (in.creditAmount + 1);
            f.put(GUARANTEE_CREDIT_RATIO, ratio);
            if (liquidity != null) f.put(WEIGHTED_GUARANTEE, ratio * liquidity.score());
        }
        return f;
    }
}
