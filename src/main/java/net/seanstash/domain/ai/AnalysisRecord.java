package net.seanstash.domain.ai;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.List;

/**
 * Persisted audit view of one provider analysis.
 */
public record AnalysisRecord(
    String id,
    long ownerId,
    List<String> commands,
    AnalysisStatus status,
    int generatedSnippets,
    @Nullable Long tokensUsed,
    @Nullable Double costUsd,
    @Nullable String errorMessage,
    Instant createdAt,
    @Nullable Instant completedAt
) {

    public AnalysisRecord {
        commands = commands == null ? List.of() : List.copyOf(commands);
    }
}
