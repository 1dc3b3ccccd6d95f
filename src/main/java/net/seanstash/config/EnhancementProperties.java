package net.seanstash.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the scheduled command enhancement worker.
 */
@Component
@ConfigurationProperties(prefix = "app.enhancement")
public class EnhancementProperties {

    /**
     * Whether the worker starts with the application.
     */
    private boolean enabled = true;

    /**
     * Fixed rate between pass starts.
     */
    private Duration interval = Duration.ofSeconds(30);

    /**
     * Maximum commands sent per owner per pass; discovery reads five times this many.
     */
    private int batchSize = 10;

    /**
     * Pause between owners within one pass.
     */
    private Duration ownerDelay = Duration.ofSeconds(2);

    private int maxCandidates = 3;

    private boolean groupSimilar = true;

    /**
     * Delete raw command records once an enhanced snippet covers them.
     */
    private boolean cleanupRedundant = true;

    private final Lease lease = new Lease();

    private final Cache cache = new Cache();

    @PostConstruct
    void validate() {
        Assert.isTrue(interval != null && !interval.isNegative() && !interval.isZero(),
            "app.enhancement.interval must be positive");
        Assert.isTrue(batchSize > 0, "app.enhancement.batch-size must be positive");
        Assert.isTrue(ownerDelay != null && !ownerDelay.isNegative(), "app.enhancement.owner-delay must be non-negative");
        Assert.isTrue(maxCandidates > 0, "app.enhancement.max-candidates must be positive");
        Assert.isTrue(lease.duration != null && !lease.duration.isNegative() && !lease.duration.isZero(),
            "app.enhancement.lease.duration must be positive");
        Assert.isTrue(cache.nearCacheSize > 0, "app.enhancement.cache.near-cache-size must be positive");
    }

    /**
     * Cross-instance pass lease settings.
     */
    public static class Lease {

        private boolean enabled = true;

        /**
         * Lease lifetime; a crashed holder blocks other instances at most this long.
         */
        private Duration duration = Duration.ofMinutes(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }
    }

    public static class Cache {

        private int nearCacheSize = 500;

        public int getNearCacheSize() {
            return nearCacheSize;
        }

        public void setNearCacheSize(int nearCacheSize) {
            this.nearCacheSize = nearCacheSize;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getOwnerDelay() {
        return ownerDelay;
    }

    public void setOwnerDelay(Duration ownerDelay) {
        this.ownerDelay = ownerDelay;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public void setMaxCandidates(int maxCandidates) {
        this.maxCandidates = maxCandidates;
    }

    public boolean isGroupSimilar() {
        return groupSimilar;
    }

    public void setGroupSimilar(boolean groupSimilar) {
        this.groupSimilar = groupSimilar;
    }

    public boolean isCleanupRedundant() {
        return cleanupRedundant;
    }

    public void setCleanupRedundant(boolean cleanupRedundant) {
        this.cleanupRedundant = cleanupRedundant;
    }

    public Lease getLease() {
        return lease;
    }

    public Cache getCache() {
        return cache;
    }
}
