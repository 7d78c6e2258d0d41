package com.ventture.credit.service;

import com.ventture.credit.controller.dto.ReasonDtos;
import com.ventture.credit.engine.explain.Contribution;
import com.ventture.credit.engine.report.DecisionReport;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.ventture.credit.service.features.CreditFeatures.*;

/** Turns the strongest contributions of a report into short localized reasons. */
@Service
public class ReasonService {

    public ReasonDtos.ReasonsResponse reasons(DecisionReport report, int topK, String locale) {
        ReasonDtos.ReasonsResponse res = new ReasonDtos.ReasonsResponse();
        res.decision = report.prediction().label().name();
        res.probability = report.prediction().probability();
        res.threshold = report.prediction().threshold();
        res.riskTier = report.prediction().riskTier().name();
        res.method = report.explanationMethod().name();
        res.reasons = topReasons(report, topK, locale);
        return res;
    }

    public List<ReasonDtos.Reason> topReasons(DecisionReport report, int topK, String locale) {
        List<ReasonDtos.Reason> out = new ArrayList<>();
        if (report == null || report.contributions().isEmpty()) return out;

        boolean pt = locale == null || locale.toLowerCase(Locale.ROOT).startsWith("pt");

        for (Contribution c : report.top(Math.max(1, topK))) {
            ReasonDtos.Reason r = new ReasonDtos.Reason();
            r.feature = c.feature();
            r.value = report.rawInput().get(c.feature());
            r.contribution = c.score();
            r.absContribution = c.absScore();
            r.direction = c.direction();

            String[] tt = titleAndText(pt, c, r.value);
            r.title = tt[0];
            r.text = tt[1];
            out.add(r);
        }
        return out;
    }

    private String[] titleAndText(boolean pt, Contribution c, Double value) {
        String direction;
        if (c.degenerate()) {
            direction = pt ? "sem efeito (variância zero no treino)" : "no effect (zero variance in training)";
        } else if (c.score() == 0.0) {
            direction = pt ? "sem efeito" : "no effect";
        } else if (c.score() > 0) {
            direction = pt ? "favorece a aprovação" : "favours approval";
        } else {
            direction = pt ? "desfavorece a aprovação" : "weighs against approval";
        }
        String v = (value == null) ? "N/A" : String.format(Locale.ROOT, "%.2f", value);
        String contrib = String.format(Locale.ROOT, "%.3f", c.absScore());

        String titlePt, titleEn;
        switch (c.feature()) {
            case INCOME -> { titlePt = "Renda mensal"; titleEn = "Monthly income"; }
            case AGE -> { titlePt = "Idade"; titleEn = "Age"; }
            case CREDIT_AMOUNT -> { titlePt = "Valor solicitado"; titleEn = "Requested amount"; }
            case GUARANTEE_VALUE -> { titlePt = "Valor da garantia"; titleEn = "Guarantee value"; }
            case GUARANTEE_CREDIT_RATIO -> { titlePt = "Cobertura da garantia"; titleEn = "Guarantee coverage"; }
            case LIQUIDITY_SCORE -> { titlePt = "Liquidez da garantia"; titleEn = "Guarantee liquidity"; }
            case INCOME_PER_AGE -> { titlePt = "Renda por idade"; titleEn = "Income per year of age"; }
            case WEIGHTED_GUARANTEE -> { titlePt = "Garantia ponderada pela liquidez"; titleEn = "Liquidity-weighted guarantee"; }
            default -> { titlePt = "Fator: " + c.feature(); titleEn = "Feature: " + c.feature(); }
        }
        String title = pt ? titlePt : titleEn;
        return new String[]{title, title + " = " + v + " " + direction + " (" + contrib + ")."};
    }
}
