package com.ventture.credit.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ventture.credit.engine.explain.Contribution;
import com.ventture.credit.engine.report.DecisionReport;
import com.ventture.credit.repository.EvaluationHistoryRepository;
import com.ventture.credit.repository.EvaluationHistoryRepository.HistoryRow;
import com.ventture.credit.service.features.CreditFeatures;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Simulation history for the analytics view. Recording never fails an evaluation. */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryService {

    static final int MAX_LIMIT = 500;
    private static final int TOP_REASONS = 3;

    private final EvaluationHistoryRepository repository;
    private final ObjectMapper objectMapper;

    public void record(DecisionReport report, String liquidity) {
        try {
            repository.save(new HistoryRow(
                    UUID.randomUUID(),
                    LocalDateTime.now(),
                    report.prediction().label().name(),
                    report.prediction().probability(),
                    report.prediction().riskTier().name(),
                    report.modelVersion(),
                    liquidity,
                    report.rawInput().get(CreditFeatures.CREDIT_AMOUNT),
                    objectMapper.writeValueAsString(report.rawInput()),
                    objectMapper.writeValueAsString(topReasons(report))));
        } catch (JsonProcessingException | DataAccessException e) {
            // best effort; the report itself is already complete
            log.warn("Could not record evaluation history: {}", e.toString());
        }
    }

    public List<HistoryRow> latest(int limit) {
        return repository.findLatest(Math.max(1, Math.min(limit, MAX_LIMIT)));
    }

    public EvaluationHistoryRepository.Summary summary() {
        return repository.summary();
    }

    public int clear() {
        int n = repository.deleteAll();
        log.info("Cleared {} history rows", n);
        return n;
    }

    private List<Map<String, Object>> topReasons(DecisionReport report) {
        return report.top(TOP_REASONS).stream().map(this::toMap).toList();
    }

    private Map<String, Object> toMap(Contribution c) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("feature", c.feature());
        m.put("contribution", c.score());
        m.put("direction", c.direction());
        return m;
    }
}
