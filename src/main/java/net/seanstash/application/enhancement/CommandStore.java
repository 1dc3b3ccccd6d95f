package net.seanstash.application.enhancement;

import java.util.List;
import java.util.Optional;
import net.seanstash.domain.ai.AnalysisCandidate;
import net.seanstash.domain.snippet.EnhancedSnippetRef;
import net.seanstash.domain.snippet.EnhancementAudit;
import net.seanstash.domain.snippet.RawCommandRecord;
import net.seanstash.domain.snippet.SnippetInsertResult;

/**
 * Durable snippet storage as seen by the enhancement worker.
 */
public interface CommandStore {

    /**
     * Raw command records that are neither marked processed nor already enhanced,
     * most recently updated first.
     */
    List<RawCommandRecord> findUnprocessedRawCommands(int limit);

    /**
     * Persists a validated candidate for the owner, or returns the id of the snippet
     * that already carries the same title.
     *
     * @return id of the created or pre-existing snippet
     * @throws net.seanstash.support.retry.AdvisoryLockAcquisitionException when another writer holds the title lock
     */
    SnippetInsertResult insertEnhancedSnippet(long ownerId, AnalysisCandidate candidate, EnhancementAudit audit);

    Optional<EnhancedSnippetRef> findSnippetByTitle(long ownerId, String title);

    /**
     * Records each command as processed for the owner; repeated marks are ignored.
     */
    void markCommandsProcessed(long ownerId, List<String> commands);

    /**
     * Deletes a raw command record with its fragments and categories.
     */
    void deleteRawCommand(long snippetId);

    List<RawCommandRecord> findRawCommandsByText(long ownerId, String command);
}
