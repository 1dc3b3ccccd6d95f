package net.seanstash.application.ai;

import java.util.Optional;
import net.seanstash.domain.ai.AnalysisResult;
import net.seanstash.domain.ai.CachedAnalysis;

/**
 * Content-addressed store of successful analysis results keyed by batch digest.
 */
public interface AnalysisCache {

    Optional<CachedAnalysis> get(String digest);

    /**
     * Stores a result for the digest; an existing entry is left untouched.
     */
    void put(String digest, String commandText, AnalysisResult result);

    /**
     * Increments the hit counter and refreshes the last-hit time.
     */
    void touchHit(String digest);
}
