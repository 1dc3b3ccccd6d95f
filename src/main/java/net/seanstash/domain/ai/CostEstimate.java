package net.seanstash.domain.ai;

/**
 * Estimated USD cost of a provider call split by token type.
 */
public record CostEstimate(double input, double output, double total) {

    public static CostEstimate none() {
        return new CostEstimate(0.0, 0.0, 0.0);
    }
}
