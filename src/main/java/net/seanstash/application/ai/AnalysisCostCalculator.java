package net.seanstash.application.ai;

import net.seanstash.domain.ai.CostEstimate;
import net.seanstash.domain.ai.TokenUsage;

/**
 * Converts token counts to USD using per-million token rates.
 */
final class AnalysisCostCalculator {

    private static final double TOKENS_PER_MILLION = 1_000_000.0;

    private final double inputCostPerMillion;
    private final double outputCostPerMillion;

    AnalysisCostCalculator(double inputCostPerMillion, double outputCostPerMillion) {
        if (inputCostPerMillion < 0 || outputCostPerMillion < 0) {
            throw new IllegalArgumentException("Token rates must be non-negative");
        }
        this.inputCostPerMillion = inputCostPerMillion;
        this.outputCostPerMillion = outputCostPerMillion;
    }

    CostEstimate estimate(TokenUsage usage) {
        double input = usage.input() / TOKENS_PER_MILLION * inputCostPerMillion;
        double output = usage.output() / TOKENS_PER_MILLION * outputCostPerMillion;
        return new CostEstimate(input, output, input + output);
    }
}
