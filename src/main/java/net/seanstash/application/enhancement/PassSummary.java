package net.seanstash.application.enhancement;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one enhancement pass.
 *
 * @param skipped true when the pass did not run because another pass held the guard or lease
 * @param failures one line per owner that failed
 */
public record PassSummary(
    boolean skipped,
    Instant startedAt,
    Instant finishedAt,
    int commandsDiscovered,
    int ownersProcessed,
    int ownersFailed,
    int snippetsCreated,
    int duplicatesSkipped,
    int rawRecordsDeleted,
    List<String> failures
) {

    public PassSummary {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static PassSummary skipped(Instant at) {
        return new PassSummary(true, at, at, 0, 0, 0, 0, 0, 0, List.of());
    }
}
