package net.seanstash.domain.ai;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of analyzing one command batch.
 *
 * <p>{@code success} is true when at least one candidate passed validation; partial
 * success is still success. Cached results carry the identifiers and measurements of
 * the analysis that originally produced them.</p>
 */
public record AnalysisResult(
    String analysisId,
    boolean success,
    boolean cached,
    List<AnalysisCandidate> validCandidates,
    List<CandidateValidationError> validationErrors,
    TokenUsage tokensUsed,
    CostEstimate cost,
    long processingTimeMs,
    String model,
    String rawResponse,
    Instant analyzedAt
) {

    public AnalysisResult {
        validCandidates = validCandidates == null ? List.of() : List.copyOf(validCandidates);
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
        tokensUsed = tokensUsed == null ? TokenUsage.none() : tokensUsed;
        cost = cost == null ? CostEstimate.none() : cost;
    }

    /**
     * Returns a copy flagged as served from the analysis cache.
     */
    public AnalysisResult asCached() {
        return new AnalysisResult(analysisId, success, true, validCandidates, validationErrors,
            tokensUsed, cost, processingTimeMs, model, rawResponse, analyzedAt);
    }
}
