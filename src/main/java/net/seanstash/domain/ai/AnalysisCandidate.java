package net.seanstash.domain.ai;

import java.util.List;

/**
 * Validated, normalized snippet proposal produced from a provider reply.
 *
 * <p>Instances only leave the validator once every invariant holds: title is at most
 * 60 characters, at most three lower-cased distinct categories, and at least one
 * fragment with non-blank file name, code and language.</p>
 */
public record AnalysisCandidate(
    String title,
    String description,
    List<String> categories,
    List<CandidateFragment> fragments,
    boolean publicSnippet,
    boolean locked
) {

    public AnalysisCandidate {
        categories = categories == null ? List.of() : List.copyOf(categories);
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
    }
}
