package net.seanstash.application.ai;

/**
 * Single-prompt completion request sent to a {@link TextGenerationProvider}.
 */
public record GenerationRequest(String model, long maxTokens, double temperature, String prompt) {
}
