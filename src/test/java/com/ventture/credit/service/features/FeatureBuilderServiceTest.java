package com.ventture.credit.service.features;

import com.ventture.credit.controller.dto.SimulationRequest;
import com.ventture.credit.engine.ApplicationInput;
import com.ventture.credit.engine.error.InvalidValueException;
import com.ventture.credit.service.features.providers.ApplicantFeaturesProvider;
import com.ventture.credit.service.features.providers.CreditLineFeaturesProvider;
import com.ventture.credit.service.features.providers.GuaranteeFeaturesProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.ventture.credit.service.features.CreditFeatures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureBuilderServiceTest {

    private final FeatureBuilderService builder = new FeatureBuilderService(List.of(
            new ApplicantFeaturesProvider(), new CreditLineFeaturesProvider(), new GuaranteeFeaturesProvider()));

    static SimulationRequest form() {
        SimulationRequest r = new SimulationRequest();
        r.income = 8000.0;
        r.age = 35;
        r.creditAmount = 50000.0;
        r.guaranteeValue = 80000.0;
        r.liquidity = "media";
        return r;
    }

    @Test
    @DisplayName("should derive all eight model features from the form")
    void allFeatures() {
        ApplicationInput in = builder.build(form());

        assertThat(in.values()).containsOnlyKeys(INCOME, AGE, CREDIT_AMOUNT, GUARANTEE_VALUE,
                GUARANTEE_CREDIT_RATIO, LIQUIDITY_SCORE, INCOME_PER_AGE, WEIGHTED_GUARANTEE);
        assertThat(in.get(INCOME_PER_AGE)).isCloseTo(8000.0 / 36, within(1e-9));
        assertThat(in.get(GUARANTEE_CREDIT_RATIO)).isCloseTo(80000.0 / 50001, within(1e-9));
        assertThat(in.get(LIQUIDITY_SCORE)).isEqualTo(2.0);
        assertThat(in.get(WEIGHTED_GUARANTEE)).isCloseTo(2 * 80000.0 / 50001, within(1e-9));
    }

    @Test
    @DisplayName("should leave out features whose inputs are absent instead of defaulting them")
    void absentInputs() {
        SimulationRequest r = form();
        r.creditAmount = null;
        r.liquidity = null;

        ApplicationInput in = builder.build(r);

        assertThat(in.has(CREDIT_AMOUNT)).isFalse();
        assertThat(in.has(GUARANTEE_CREDIT_RATIO)).isFalse();
        assertThat(in.has(LIQUIDITY_SCORE)).isFalse();
        assertThat(in.has(WEIGHTED_GUARANTEE)).isFalse();
        assertThat(in.has(INCOME_PER_AGE)).isTrue();
    }

    @ParameterizedTest
    @CsvSource({"low,1", "baixa,1", "MEDIUM,2", "média,2", "alta,3", " high ,3"})
    @DisplayName("liquidity accepts English and Portuguese names")
    void liquidityNames(String raw, int score) {
        assertThat(Liquidity.parse(raw).score()).isEqualTo(score);
    }

    @Test
    @DisplayName("unknown liquidity is an invalid value")
    void unknownLiquidity() {
        SimulationRequest r = form();
        r.liquidity = "instant";

        assertThatThrownBy(() -> builder.build(r))
                .isInstanceOfSatisfying(InvalidValueException.class,
                        e -> assertThat(e.getFeature()).isEqualTo("liquidity"));
    }
}
