package net.seanstash.domain.ai;

import java.time.Instant;

/**
 * Analysis cache entry keyed by batch digest.
 */
public record CachedAnalysis(
    String digest,
    AnalysisResult result,
    int hits,
    Instant createdAt,
    Instant lastHitAt
) {

    /**
     * Returns the entry as it looks after one more hit at {@code hitAt}.
     */
    public CachedAnalysis withHit(Instant hitAt) {
        return new CachedAnalysis(digest, result, hits + 1, createdAt, hitAt);
    }
}
