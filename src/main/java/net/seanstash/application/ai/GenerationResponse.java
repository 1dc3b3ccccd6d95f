package net.seanstash.application.ai;

/**
 * Provider reply text with the token counts the provider reported.
 */
public record GenerationResponse(String text, long tokensIn, long tokensOut) {
}
