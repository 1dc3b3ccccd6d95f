package net.seanstash.domain.ai;

import java.util.List;

/**
 * Field-level reasons a candidate at {@code candidateIndex} was rejected.
 */
public record CandidateValidationError(int candidateIndex, List<String> errors) {

    public CandidateValidationError {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
