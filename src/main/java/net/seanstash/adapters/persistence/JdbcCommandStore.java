package net.seanstash.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import net.seanstash.application.ai.CommandBatchHasher;
import net.seanstash.application.enhancement.CommandStore;
import net.seanstash.domain.ai.AnalysisCandidate;
import net.seanstash.domain.ai.CandidateFragment;
import net.seanstash.domain.snippet.EnhancedSnippetRef;
import net.seanstash.domain.snippet.EnhancementAudit;
import net.seanstash.domain.snippet.RawCommandRecord;
import net.seanstash.domain.snippet.SnippetInsertResult;
import net.seanstash.support.retry.AdvisoryLockAcquisitionException;
import net.seanstash.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres adapter for raw terminal commands and the snippets enhanced from them.
 *
 * <p>Owns the SQL for {@code snippets}, {@code fragments}, {@code categories},
 * {@code snippet_ai_analysis} and {@code processed_cli_commands}.</p>
 */
@Repository
public class JdbcCommandStore implements CommandStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCommandStore.class);
    private static final String RAW_TITLE_PATTERN = RawCommandRecord.TITLE_PREFIX + "%";

    private static final String RAW_COMMAND_SELECT = """
        SELECT s.id, s.user_id, s.title, f.code, s.updated_at
        FROM snippets s
        JOIN LATERAL (
            SELECT code FROM fragments WHERE snippet_id = s.id ORDER BY position, id LIMIT 1
        ) f ON TRUE
        WHERE s.title LIKE ?
          AND EXISTS (SELECT 1 FROM categories c WHERE c.snippet_id = s.id AND c.name = ?)
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcCommandStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public List<RawCommandRecord> findUnprocessedRawCommands(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        String sql = RAW_COMMAND_SELECT + """
              AND NOT EXISTS (SELECT 1 FROM snippet_ai_analysis a WHERE a.snippet_id = s.id)
              AND NOT EXISTS (
                  SELECT 1 FROM processed_cli_commands p
                  WHERE p.user_id = s.user_id
                    AND p.command_hash = encode(sha256(convert_to(f.code, 'UTF8')), 'hex')
              )
            ORDER BY s.updated_at DESC, s.id DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, this::mapRawCommand,
            RAW_TITLE_PATTERN, RawCommandRecord.MARKER_CATEGORY, limit);
    }

    @Override
    @Transactional
    public SnippetInsertResult insertEnhancedSnippet(long ownerId, AnalysisCandidate candidate, EnhancementAudit audit) {
        if (candidate == null) {
            throw new IllegalArgumentException("candidate is required");
        }
        if (audit == null) {
            throw new IllegalArgumentException("audit is required");
        }
        if (candidate.title().startsWith(RawCommandRecord.TITLE_PREFIX)) {
            throw new IllegalArgumentException("Enhanced snippet title must not use the raw command prefix: " + candidate.title());
        }

        lockOwnerTitle(ownerId, candidate.title());
        Optional<EnhancedSnippetRef> existing = findSnippetByTitle(ownerId, candidate.title());
        if (existing.isPresent()) {
            log.info("Skipping duplicate snippet '{}' for owner {} (existing id={})",
                candidate.title(), ownerId, existing.get().snippetId());
            return SnippetInsertResult.existing(existing.get().snippetId());
        }

        Long snippetId = jdbcTemplate.queryForObject(
            """
            INSERT INTO snippets (user_id, title, description, is_public, locked, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """,
            Long.class,
            ownerId,
            candidate.title(),
            candidate.description(),
            candidate.publicSnippet(),
            candidate.locked(),
            Timestamp.from(audit.createdAt()),
            Timestamp.from(audit.createdAt())
        );
        if (snippetId == null) {
            throw new IllegalStateException("Snippet insert returned no id for owner " + ownerId);
        }

        List<Object[]> categoryRows = new ArrayList<>();
        for (String category : candidate.categories()) {
            categoryRows.add(new Object[] {snippetId, category});
        }
        if (!categoryRows.isEmpty()) {
            jdbcTemplate.batchUpdate("INSERT INTO categories (snippet_id, name) VALUES (?, ?)", categoryRows);
        }

        List<Object[]> fragmentRows = new ArrayList<>();
        for (CandidateFragment fragment : candidate.fragments()) {
            fragmentRows.add(new Object[] {
                snippetId, fragment.fileName(), fragment.code(), fragment.language(), fragment.position()
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO fragments (snippet_id, file_name, code, language, position) VALUES (?, ?, ?, ?, ?)",
            fragmentRows
        );

        jdbcTemplate.update(
            """
            INSERT INTO snippet_ai_analysis (snippet_id, original_commands, ai_analysis_id, created_at)
            VALUES (?, CAST(? AS jsonb), ?, ?)
            """,
            snippetId,
            serializeJson(audit.sourceCommands()),
            audit.analysisId(),
            Timestamp.from(audit.createdAt())
        );
        return SnippetInsertResult.created(snippetId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<EnhancedSnippetRef> findSnippetByTitle(long ownerId, String title) {
        if (title == null) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
            """
            SELECT id, user_id, title FROM snippets
            WHERE user_id = ? AND title = ? AND title NOT LIKE ?
            ORDER BY id
            LIMIT 1
            """,
            rs -> rs.next()
                ? Optional.of(new EnhancedSnippetRef(rs.getLong("id"), rs.getLong("user_id"), rs.getString("title")))
                : Optional.<EnhancedSnippetRef>empty(),
            ownerId, title, RAW_TITLE_PATTERN
        );
    }

    @Override
    @Transactional
    public void markCommandsProcessed(long ownerId, List<String> commands) {
        if (commands == null || commands.isEmpty()) {
            return;
        }
        Set<String> hashes = new LinkedHashSet<>();
        for (String command : commands) {
            hashes.add(CommandBatchHasher.digest(command));
        }
        List<Object[]> rows = new ArrayList<>();
        for (String hash : hashes) {
            rows.add(new Object[] {ownerId, hash});
        }
        jdbcTemplate.batchUpdate(
            """
            INSERT INTO processed_cli_commands (user_id, command_hash, processed_at)
            VALUES (?, ?, NOW())
            ON CONFLICT (user_id, command_hash) DO NOTHING
            """,
            rows
        );
    }

    @Override
    @Transactional
    public void deleteRawCommand(long snippetId) {
        jdbcTemplate.update("DELETE FROM fragments WHERE snippet_id = ?", snippetId);
        jdbcTemplate.update("DELETE FROM categories WHERE snippet_id = ?", snippetId);
        jdbcTemplate.update("DELETE FROM snippets WHERE id = ?", snippetId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RawCommandRecord> findRawCommandsByText(long ownerId, String command) {
        if (command == null) {
            return List.of();
        }
        String sql = RAW_COMMAND_SELECT + """
              AND s.user_id = ?
              AND f.code = ?
            ORDER BY s.id
            """;
        return jdbcTemplate.query(sql, this::mapRawCommand,
            RAW_TITLE_PATTERN, RawCommandRecord.MARKER_CATEGORY, ownerId, command);
    }

    private void lockOwnerTitle(long ownerId, String title) {
        long lockKey = HashUtils.sha256Prefix64(ownerId + "|" + title);
        Boolean acquired = jdbcTemplate.queryForObject("SELECT pg_try_advisory_xact_lock(?)", Boolean.class, lockKey);
        if (!Boolean.TRUE.equals(acquired)) {
            throw new AdvisoryLockAcquisitionException("snippet title '" + title + "' of owner " + ownerId, lockKey);
        }
        log.debug("Acquired advisory lock {} for owner {} title '{}'", lockKey, ownerId, title);
    }

    private RawCommandRecord mapRawCommand(ResultSet rs, int rowNum) throws SQLException {
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        Instant updated = updatedAt != null ? updatedAt.toInstant() : null;
        return new RawCommandRecord(
            rs.getLong("id"),
            rs.getLong("user_id"),
            rs.getString("title"),
            rs.getString("code"),
            updated
        );
    }

    private String serializeJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JacksonException ex) {
            log.error("Failed to serialize snippet audit payload type={}", payload.getClass().getSimpleName(), ex);
            throw new IllegalStateException("Failed to serialize snippet audit payload", ex);
        }
    }
}
