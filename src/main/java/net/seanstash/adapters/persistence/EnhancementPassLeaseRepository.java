package net.seanstash.adapters.persistence;

import java.time.Duration;
import net.seanstash.application.enhancement.EnhancementPassLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Single-row lease in {@code enhancement_pass_lease} shared by all worker instances.
 *
 * <p>A lease is taken when no row exists, when it has expired, or when the caller
 * already holds it.</p>
 */
@Repository
@ConditionalOnProperty(prefix = "app.enhancement.lease", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EnhancementPassLeaseRepository implements EnhancementPassLock {

    static final String LEASE_NAME = "command-enhancement-pass";

    private final JdbcTemplate jdbcTemplate;

    public EnhancementPassLeaseRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean tryAcquire(String holderId, Duration leaseDuration) {
        if (holderId == null || holderId.isBlank()) {
            throw new IllegalArgumentException("holderId is required");
        }
        int updated = jdbcTemplate.update(
            """
            INSERT INTO enhancement_pass_lease (lease_name, holder_id, acquired_at, expires_at)
            VALUES (?, ?, NOW(), NOW() + (? * INTERVAL '1 millisecond'))
            ON CONFLICT (lease_name) DO UPDATE
            SET holder_id = EXCLUDED.holder_id,
                acquired_at = EXCLUDED.acquired_at,
                expires_at = EXCLUDED.expires_at
            WHERE enhancement_pass_lease.expires_at < NOW()
               OR enhancement_pass_lease.holder_id = EXCLUDED.holder_id
            """,
            LEASE_NAME, holderId, leaseDuration.toMillis()
        );
        return updated > 0;
    }

    @Override
    public void release(String holderId) {
        jdbcTemplate.update(
            "DELETE FROM enhancement_pass_lease WHERE lease_name = ? AND holder_id = ?",
            LEASE_NAME, holderId
        );
    }
}
