package net.seanstash.adapters.persistence;

import java.sql.Timestamp;
import java.time.Instant;
import net.seanstash.domain.ai.UsageRecord;
import net.seanstash.domain.ai.UsageSummary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only token and cost ledger in {@code ai_usage}.
 */
@Repository
public class AiUsageRepository {

    private final JdbcTemplate jdbcTemplate;

    public AiUsageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void append(UsageRecord usage) {
        if (usage == null) {
            throw new IllegalArgumentException("usage is required");
        }
        jdbcTemplate.update(
            """
            INSERT INTO ai_usage (user_id, analysis_id, tokens_input, tokens_output, cost_usd, model_used, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            usage.ownerId(),
            usage.analysisId(),
            usage.tokensInput(),
            usage.tokensOutput(),
            usage.costUsd(),
            usage.model(),
            Timestamp.from(usage.createdAt())
        );
    }

    @Transactional(readOnly = true)
    public UsageSummary summarize(long ownerId, Instant since) {
        UsageSummary summary = jdbcTemplate.query(
            """
            SELECT COUNT(*) AS total_analyses,
                   COALESCE(SUM(tokens_input), 0) AS total_tokens_input,
                   COALESCE(SUM(tokens_output), 0) AS total_tokens_output,
                   COALESCE(SUM(cost_usd), 0) AS total_cost,
                   COALESCE(AVG(cost_usd), 0) AS avg_cost
            FROM ai_usage
            WHERE user_id = ? AND created_at >= ?
            """,
            rs -> rs.next()
                ? new UsageSummary(
                    rs.getLong("total_analyses"),
                    rs.getLong("total_tokens_input"),
                    rs.getLong("total_tokens_output"),
                    rs.getDouble("total_cost"),
                    rs.getDouble("avg_cost"))
                : null,
            ownerId,
            Timestamp.from(since)
        );
        return summary != null ? summary : UsageSummary.empty();
    }
}
