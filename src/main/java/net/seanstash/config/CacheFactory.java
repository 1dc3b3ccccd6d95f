package net.seanstash.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import net.seanstash.domain.ai.CachedAnalysis;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Factory for Caffeine caches with consistent configuration.
 */
@Configuration
public class CacheFactory {

    /**
     * Create a cache with size limit only (no TTL).
     */
    public <K, V> Cache<K, V> createCacheWithSize(int maxSize) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .recordStats()
            .build();
    }

    /**
     * In-process copy of analysis cache rows; entries never expire because the rows never do.
     */
    @Bean
    public Cache<String, CachedAnalysis> analysisNearCache(EnhancementProperties properties) {
        return createCacheWithSize(properties.getCache().getNearCacheSize());
    }
}
