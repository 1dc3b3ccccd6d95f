package net.seanstash.application.ai;

/**
 * Thrown when a provider reply contains no usable JSON document or no candidate array.
 *
 * <p>A reply was received, so callers treat the batch as consumed rather than retrying it.</p>
 */
public class AnalysisExtractionException extends RuntimeException {

    private final String analysisId;

    public AnalysisExtractionException(String message) {
        this(message, null, null);
    }

    public AnalysisExtractionException(String message, String analysisId, Throwable cause) {
        super(message, cause);
        this.analysisId = analysisId;
    }

    /**
     * Returns a copy bound to the analysis that produced the unusable reply.
     */
    public AnalysisExtractionException withAnalysisId(String boundAnalysisId) {
        return new AnalysisExtractionException(getMessage(), boundAnalysisId, this);
    }

    public String analysisId() {
        return analysisId;
    }
}
