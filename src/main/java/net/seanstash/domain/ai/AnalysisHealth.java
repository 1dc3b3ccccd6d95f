package net.seanstash.domain.ai;

/**
 * Provider readiness as reported to operators.
 *
 * @param status one of {@code ready}, {@code not_configured} or {@code error}
 */
public record AnalysisHealth(boolean configured, String model, double temperature, long maxTokens, String status) {

    public static final String READY = "ready";
    public static final String NOT_CONFIGURED = "not_configured";
    public static final String ERROR = "error";
}
