package net.seanstash.domain.ai;

import java.time.Instant;

/**
 * Append-only ledger line for one provider call.
 */
public record UsageRecord(
    long ownerId,
    String analysisId,
    long tokensInput,
    long tokensOutput,
    double costUsd,
    String model,
    Instant createdAt
) {
}
