package com.ventture.credit.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class EvaluationHistoryRepository {

    private final JdbcTemplate jdbc;

    public void save(HistoryRow row) {
        jdbc.update("""
            INSERT INTO evaluation_history
                (id, created_at, decision, probability, risk_tier, model_version, liquidity, credit_amount, raw_input, top_reasons)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """,
                row.id().toString(),
                Timestamp.valueOf(row.createdAt()),
                row.decision(),
                row.probability(),
                row.riskTier(),
                row.modelVersion(),
                row.liquidity(),
                row.creditAmount(),
                row.rawInputJson(),
                row.topReasonsJson());
    }

    public List<HistoryRow> findLatest(int limit) {
        String sql = """
            SELECT id, created_at, decision, probability, risk_tier, model_version, liquidity, credit_amount, raw_input, top_reasons
            FROM evaluation_history
            ORDER BY created_at DESC, seq DESC
            LIMIT ?
        """;
        return jdbc.query(sql, rm(), limit);
    }

    public Summary summary() {
        Summary totals = jdbc.queryForObject("""
            SELECT COUNT(*) AS total,
                   AVG(CASE WHEN decision = 'APPROVED' THEN 1.0 ELSE 0.0 END) AS approval_rate,
                   AVG(probability) AS mean_probability
            FROM evaluation_history
        """, (rs, i) -> new Summary(
                rs.getLong("total"),
                rs.getDouble("approval_rate"),
                rs.getDouble("mean_probability"),
                Map.of(), Map.of()));

        Map<String, Double> byLiquidity = new LinkedHashMap<>();
        jdbc.query("""
            SELECT liquidity, AVG(CASE WHEN decision = 'APPROVED' THEN 1.0 ELSE 0.0 END) AS approval_rate
            FROM evaluation_history
            WHERE liquidity IS NOT NULL
            GROUP BY liquidity
            ORDER BY liquidity
        """, (RowCallbackHandler) rs -> {
            byLiquidity.put(rs.getString("liquidity"), rs.getDouble("approval_rate"));
        });

        // bands are right-closed, as in the analytics view: (0, 50k], (50k, 150k], ...
        Map<String, Double> byCreditBand = new LinkedHashMap<>();
        jdbc.query("""
            SELECT band, AVG(probability) AS mean_probability
            FROM (
                SELECT probability, credit_amount,
                       CASE WHEN credit_amount <= 50000 THEN '0-50k'
                            WHEN credit_amount <= 150000 THEN '50k-150k'
                            WHEN credit_amount <= 300000 THEN '150k-300k'
                            WHEN credit_amount <= 500000 THEN '300k-500k'
                            ELSE '500k+' END AS band
                FROM evaluation_history
                WHERE credit_amount > 0
            ) banded
            GROUP BY band
            ORDER BY MIN(credit_amount)
        """, (RowCallbackHandler) rs -> byCreditBand.put(rs.getString("band"), rs.getDouble("mean_probability")));

        return new Summary(totals.total(), totals.approvalRate(), totals.meanProbability(), byLiquidity, byCreditBand);
    }

    public int deleteAll() {
        return jdbc.update("DELETE FROM evaluation_history");
    }

    private RowMapper<HistoryRow> rm() {
        return (rs, i) -> new HistoryRow(
                UUID.fromString(rs.getString("id")),
                rs.getTimestamp("created_at").toLocalDateTime(),
                rs.getString("decision"),
                rs.getDouble("probability"),
                rs.getString("risk_tier"),
                rs.getString("model_version"),
                rs.getString("liquidity"),
                rs.getObject("credit_amount", Double.class),
                rs.getString("raw_input"),
                rs.getString("top_reasons")
        );
    }

    public record HistoryRow(
            UUID id, LocalDateTime createdAt, String decision, double probability, String riskTier,
            String modelVersion, String liquidity, Double creditAmount, String rawInputJson, String topReasonsJson
    ) {}

    /**
     * Rates are fractions in [0,1]; zero when the history is empty. Per-band entries only exist for
     * bands with at least one evaluation, in ascending amount order.
     */
    public record Summary(
            long total, double approvalRate, double meanProbability,
            Map<String, Double> approvalRateByLiquidity, Map<String, Double> meanProbabilityByCreditBand
    ) {}
}
