package net.seanstash.domain.ai;

/**
 * One code fragment of a candidate; {@code position} is the zero-based index within its candidate.
 */
public record CandidateFragment(String fileName, String code, String language, int position) {
}
