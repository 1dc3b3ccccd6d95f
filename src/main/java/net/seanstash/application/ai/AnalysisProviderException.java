package net.seanstash.application.ai;

import java.util.Objects;

/**
 * Thrown when the text generation provider cannot produce a reply.
 *
 * <p>Covers credentials, throttling, timeouts, transport failures and empty replies.
 * No reply was received, so the affected batch stays eligible for the next pass.</p>
 */
public class AnalysisProviderException extends RuntimeException {

    /**
     * Canonical failure categories for provider calls.
     */
    public enum ErrorCode {
        AUTHENTICATION,
        RATE_LIMITED,
        TIMEOUT,
        NETWORK,
        MALFORMED_RESPONSE,
        NOT_CONFIGURED,
        PROVIDER_FAILURE
    }

    private final ErrorCode errorCode;

    public AnalysisProviderException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public AnalysisProviderException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
