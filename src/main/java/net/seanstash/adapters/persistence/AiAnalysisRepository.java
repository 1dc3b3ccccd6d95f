package net.seanstash.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import net.seanstash.domain.ai.AnalysisRecord;
import net.seanstash.domain.ai.AnalysisStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Audit trail of provider analyses in {@code ai_analyses}.
 */
@Repository
public class AiAnalysisRepository {

    private static final Logger log = LoggerFactory.getLogger(AiAnalysisRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };

    private static final String SELECT_COLUMNS = """
        SELECT id, user_id, commands, status, generated_snippets, tokens_used, cost_usd,
               error_message, created_at, completed_at
        FROM ai_analyses
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public AiAnalysisRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public void createProcessing(String analysisId, long ownerId, List<String> commands) {
        jdbcTemplate.update(
            """
            INSERT INTO ai_analyses (id, user_id, commands, status, created_at)
            VALUES (?, ?, CAST(? AS jsonb), ?, NOW())
            """,
            analysisId, ownerId, serializeJson(commands), AnalysisStatus.PROCESSING.dbValue()
        );
    }

    /**
     * Closes an analysis as completed with its result payload and measurements.
     */
    @Transactional
    public void markCompleted(String analysisId, Object result, int generatedSnippets, long tokensUsed, double costUsd) {
        jdbcTemplate.update(
            """
            UPDATE ai_analyses
            SET status = ?, analysis_result = CAST(? AS jsonb), generated_snippets = ?,
                tokens_used = ?, cost_usd = ?, completed_at = NOW(), error_message = NULL
            WHERE id = ?
            """,
            AnalysisStatus.COMPLETED.dbValue(), serializeJson(result), generatedSnippets,
            tokensUsed, costUsd, analysisId
        );
    }

    /**
     * Closes an analysis as failed. Token and cost columns stay null when no reply was received.
     */
    @Transactional
    public void markFailed(String analysisId, String errorMessage, Long tokensUsed, Double costUsd) {
        jdbcTemplate.update(
            """
            UPDATE ai_analyses
            SET status = ?, error_message = ?, tokens_used = ?, cost_usd = ?, completed_at = NOW()
            WHERE id = ?
            """,
            AnalysisStatus.FAILED.dbValue(), errorMessage, tokensUsed, costUsd, analysisId
        );
    }

    @Transactional(readOnly = true)
    public Optional<AnalysisRecord> findById(String analysisId, long ownerId) {
        List<AnalysisRecord> rows = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE id = ? AND user_id = ?",
            this::mapRecord,
            analysisId, ownerId
        );
        return rows.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<AnalysisRecord> findRecent(long ownerId, Instant since, int limit) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE user_id = ? AND created_at >= ? ORDER BY created_at DESC LIMIT ?",
            this::mapRecord,
            ownerId, Timestamp.from(since), limit
        );
    }

    private AnalysisRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        long tokens = rs.getLong("tokens_used");
        Long tokensUsed = rs.wasNull() ? null : tokens;
        double cost = rs.getDouble("cost_usd");
        Double costUsd = rs.wasNull() ? null : cost;
        Timestamp completedAt = rs.getTimestamp("completed_at");
        return new AnalysisRecord(
            rs.getString("id"),
            rs.getLong("user_id"),
            deserializeCommands(rs.getString("commands")),
            AnalysisStatus.fromDbValue(rs.getString("status")),
            rs.getInt("generated_snippets"),
            tokensUsed,
            costUsd,
            rs.getString("error_message"),
            rs.getTimestamp("created_at").toInstant(),
            completedAt != null ? completedAt.toInstant() : null
        );
    }

    private List<String> deserializeCommands(String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Stored analysis commands are not a JSON string array", ex);
        }
    }

    private String serializeJson(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JacksonException ex) {
            log.error("Failed to serialize analysis payload type={}", payload.getClass().getSimpleName(), ex);
            throw new IllegalStateException("Failed to serialize analysis payload: " + payload.getClass().getSimpleName(), ex);
        }
    }
}
