package net.seanstash.adapters.persistence;

import com.github.benmanes.caffeine.cache.Cache;
import java.time.Instant;
import java.util.Optional;
import net.seanstash.application.ai.AnalysisCache;
import net.seanstash.domain.ai.AnalysisResult;
import net.seanstash.domain.ai.CachedAnalysis;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Caffeine near-cache in front of {@link CommandAnalysisCacheRepository}.
 *
 * <p>Postgres stays the source of truth: writes and hit counts always go through,
 * reads are served locally once an entry has been seen.</p>
 */
@Component
@Primary
public class NearCachingAnalysisCache implements AnalysisCache {

    private final CommandAnalysisCacheRepository delegate;
    private final Cache<String, CachedAnalysis> nearCache;

    public NearCachingAnalysisCache(CommandAnalysisCacheRepository delegate, Cache<String, CachedAnalysis> analysisNearCache) {
        this.delegate = delegate;
        this.nearCache = analysisNearCache;
    }

    @Override
    public Optional<CachedAnalysis> get(String digest) {
        if (digest == null) {
            return Optional.empty();
        }
        CachedAnalysis local = nearCache.getIfPresent(digest);
        if (local != null) {
            return Optional.of(local);
        }
        Optional<CachedAnalysis> stored = delegate.get(digest);
        stored.ifPresent(entry -> nearCache.put(digest, entry));
        return stored;
    }

    @Override
    public void put(String digest, String commandText, AnalysisResult result) {
        delegate.put(digest, commandText, result);
        nearCache.invalidate(digest);
    }

    @Override
    public void touchHit(String digest) {
        delegate.touchHit(digest);
        nearCache.asMap().computeIfPresent(digest, (key, entry) -> entry.withHit(Instant.now()));
    }
}
