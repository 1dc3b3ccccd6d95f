package net.seanstash.application.enhancement;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import net.seanstash.domain.ai.AnalysisCandidate;
import net.seanstash.domain.snippet.EnhancedSnippetRef;
import net.seanstash.domain.snippet.EnhancementAudit;
import net.seanstash.domain.snippet.RawCommandRecord;
import net.seanstash.domain.snippet.SnippetInsertResult;
import net.seanstash.support.retry.AdvisoryLockAcquisitionException;
import net.seanstash.support.retry.AdvisoryLockRetrySupport;
import net.seanstash.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Applies an analysis outcome to the snippet store: creates enhanced snippets,
 * marks source commands processed and removes superseded raw records.
 *
 * <p>Every step is best effort per item. A failed insert or delete is logged and
 * does not undo snippets that were already written.</p>
 */
@Service
public class EnhancedSnippetReconciler {

    private static final Logger log = LoggerFactory.getLogger(EnhancedSnippetReconciler.class);

    private final CommandStore commandStore;

    public EnhancedSnippetReconciler(CommandStore commandStore) {
        this.commandStore = commandStore;
    }

    /**
     * Counts from persisting one batch of candidates.
     */
    public record PersistOutcome(int created, int duplicates, int failed) {
    }

    public PersistOutcome persistCandidates(long ownerId,
                                            List<AnalysisCandidate> candidates,
                                            List<String> sourceCommands,
                                            String analysisId) {
        int created = 0;
        int duplicates = 0;
        int failed = 0;
        EnhancementAudit audit = new EnhancementAudit(sourceCommands, analysisId, Instant.now());

        for (AnalysisCandidate candidate : candidates) {
            try {
                Optional<EnhancedSnippetRef> existing = commandStore.findSnippetByTitle(ownerId, candidate.title());
                if (existing.isPresent()) {
                    log.info("Skipping duplicate snippet '{}' for owner {} (existing id={})",
                        candidate.title(), ownerId, existing.get().snippetId());
                    duplicates++;
                    continue;
                }
                SnippetInsertResult result = AdvisoryLockRetrySupport.execute(
                    AdvisoryLockRetrySupport.RetryConfig.forSnippetInsert(log),
                    "enhanced snippet insert",
                    () -> commandStore.insertEnhancedSnippet(ownerId, candidate, audit)
                );
                if (result.created()) {
                    created++;
                    log.info("Created enhanced snippet {} '{}' for owner {}", result.snippetId(), candidate.title(), ownerId);
                } else {
                    duplicates++;
                }
            } catch (DataAccessException | AdvisoryLockAcquisitionException | IllegalArgumentException exception) {
                failed++;
                LoggingUtils.error(log, exception, "Failed to persist enhanced snippet '{}' for owner {}",
                    candidate.title(), ownerId);
            }
        }
        return new PersistOutcome(created, duplicates, failed);
    }

    /**
     * Marks the whole submitted batch processed for the owner.
     *
     * @return false when the marks could not be written
     */
    public boolean markProcessed(long ownerId, List<String> commands) {
        try {
            commandStore.markCommandsProcessed(ownerId, commands);
            return true;
        } catch (DataAccessException exception) {
            LoggingUtils.error(log, exception, "Failed to mark {} commands processed for owner {}", commands.size(), ownerId);
            return false;
        }
    }

    /**
     * Deletes the owner's raw records whose command text matches any of {@code commands}.
     *
     * @return number of raw records deleted
     */
    public int removeRedundantRawCommands(long ownerId, List<String> commands) {
        int deleted = 0;
        for (String command : new LinkedHashSet<>(commands)) {
            List<RawCommandRecord> redundant;
            try {
                redundant = commandStore.findRawCommandsByText(ownerId, command);
            } catch (DataAccessException exception) {
                LoggingUtils.warn(log, exception, "Failed to look up raw records for cleanup (owner {})", ownerId);
                continue;
            }
            for (RawCommandRecord record : redundant) {
                try {
                    commandStore.deleteRawCommand(record.snippetId());
                    deleted++;
                } catch (DataAccessException exception) {
                    LoggingUtils.warn(log, exception, "Failed to delete raw command snippet {} for owner {}",
                        record.snippetId(), ownerId);
                }
            }
        }
        if (deleted > 0) {
            log.info("Removed {} redundant raw command snippets for owner {}", deleted, ownerId);
        }
        return deleted;
    }
}
