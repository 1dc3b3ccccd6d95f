package net.seanstash.domain.snippet;

import java.time.Instant;
import java.util.List;

/**
 * Audit link from an enhanced snippet back to the raw commands and analysis it came from.
 */
public record EnhancementAudit(List<String> sourceCommands, String analysisId, Instant createdAt) {

    public EnhancementAudit {
        sourceCommands = sourceCommands == null ? List.of() : List.copyOf(sourceCommands);
    }
}
