package net.seanstash.application.ai;

/**
 * Per-call analysis knobs.
 *
 * @param maxCandidates upper bound on snippets requested and returned
 * @param groupSimilar whether the prompt asks the model to merge related commands
 */
public record AnalysisOptions(int maxCandidates, boolean groupSimilar) {

    public static final int DEFAULT_MAX_CANDIDATES = 3;

    public AnalysisOptions {
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("maxCandidates must be at least 1 but was " + maxCandidates);
        }
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(DEFAULT_MAX_CANDIDATES, true);
    }
}
