package net.seanstash.domain.ai;

/**
 * Provider token counts for a single call.
 */
public record TokenUsage(long input, long output, long total) {

    public static TokenUsage of(long input, long output) {
        return new TokenUsage(input, output, input + output);
    }

    public static TokenUsage none() {
        return new TokenUsage(0L, 0L, 0L);
    }
}
