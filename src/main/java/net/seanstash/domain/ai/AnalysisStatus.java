package net.seanstash.domain.ai;

import java.util.Locale;

/**
 * Lifecycle of an analysis audit row.
 */
public enum AnalysisStatus {
    PROCESSING,
    COMPLETED,
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AnalysisStatus fromDbValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Analysis status must not be null");
        }
        return AnalysisStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
