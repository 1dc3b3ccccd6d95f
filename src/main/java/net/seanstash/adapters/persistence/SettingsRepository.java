package net.seanstash.adapters.persistence;

import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Read access to the instance-wide {@code settings} key/value table.
 */
@Repository
public class SettingsRepository {

    private final JdbcTemplate jdbcTemplate;

    public SettingsRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<String> findValue(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
            "SELECT value FROM settings WHERE key = ?",
            rs -> rs.next() ? Optional.ofNullable(rs.getString("value")) : Optional.<String>empty(),
            key
        );
    }
}
