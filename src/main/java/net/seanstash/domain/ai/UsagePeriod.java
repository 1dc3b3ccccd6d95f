package net.seanstash.domain.ai;

import java.time.Duration;
import java.util.Locale;

/**
 * Look-back windows accepted by usage reporting.
 */
public enum UsagePeriod {
    DAY(Duration.ofDays(1)),
    WEEK(Duration.ofDays(7)),
    MONTH(Duration.ofDays(30)),
    YEAR(Duration.ofDays(365));

    private final Duration window;

    UsagePeriod(Duration window) {
        this.window = window;
    }

    public Duration window() {
        return window;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a case-insensitive period label.
     *
     * @throws IllegalArgumentException for unknown labels
     */
    public static UsagePeriod fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MONTH;
        }
        for (UsagePeriod period : values()) {
            if (period.label().equals(label.trim().toLowerCase(Locale.ROOT))) {
                return period;
            }
        }
        throw new IllegalArgumentException("Unsupported usage period: " + label + " (expected day, week, month or year)");
    }
}
