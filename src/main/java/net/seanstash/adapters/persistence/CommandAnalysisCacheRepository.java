package net.seanstash.adapters.persistence;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import net.seanstash.application.ai.AnalysisCache;
import net.seanstash.domain.ai.AnalysisResult;
import net.seanstash.domain.ai.CachedAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres-backed analysis cache stored in {@code command_analysis_cache}.
 */
@Repository
public class CommandAnalysisCacheRepository implements AnalysisCache {

    private static final Logger log = LoggerFactory.getLogger(CommandAnalysisCacheRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public CommandAnalysisCacheRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CachedAnalysis> get(String digest) {
        if (digest == null || digest.isBlank()) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
            """
            SELECT analysis_result, hits, created_at, last_hit
            FROM command_analysis_cache
            WHERE command_hash = ?
            """,
            rs -> {
                if (!rs.next()) {
                    return Optional.<CachedAnalysis>empty();
                }
                AnalysisResult result = deserialize(rs.getString("analysis_result"), digest);
                return Optional.of(new CachedAnalysis(
                    digest,
                    result,
                    rs.getInt("hits"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("last_hit"))
                ));
            },
            digest
        );
    }

    @Override
    @Transactional
    public void put(String digest, String commandText, AnalysisResult result) {
        if (digest == null || digest.isBlank()) {
            throw new IllegalArgumentException("digest is required");
        }
        if (result == null) {
            throw new IllegalArgumentException("result is required");
        }
        int inserted = jdbcTemplate.update(
            """
            INSERT INTO command_analysis_cache (command_hash, command_text, analysis_result, created_at, hits, last_hit)
            VALUES (?, ?, CAST(? AS jsonb), NOW(), 1, NOW())
            ON CONFLICT (command_hash) DO NOTHING
            """,
            digest,
            commandText == null ? "" : commandText,
            serialize(result)
        );
        if (inserted == 0) {
            log.debug("Analysis cache already held digest {}", digest);
        }
    }

    @Override
    @Transactional
    public void touchHit(String digest) {
        jdbcTemplate.update(
            "UPDATE command_analysis_cache SET hits = hits + 1, last_hit = NOW() WHERE command_hash = ?",
            digest
        );
    }

    private String serialize(AnalysisResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JacksonException ex) {
            log.error("Failed to serialize analysis result {}", result.analysisId(), ex);
            throw new IllegalStateException("Failed to serialize analysis result " + result.analysisId(), ex);
        }
    }

    private AnalysisResult deserialize(String json, String digest) {
        try {
            return objectMapper.readValue(json, AnalysisResult.class);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Cached analysis for digest " + digest + " is not readable", ex);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
