package net.seanstash.domain.ai;

/**
 * Aggregated usage ledger totals for one owner over a time window.
 */
public record UsageSummary(
    long totalAnalyses,
    long totalTokensInput,
    long totalTokensOutput,
    double totalCost,
    double avgCostPerAnalysis
) {

    public static UsageSummary empty() {
        return new UsageSummary(0L, 0L, 0L, 0.0, 0.0);
    }
}
