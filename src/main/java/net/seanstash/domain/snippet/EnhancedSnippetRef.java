package net.seanstash.domain.snippet;

/**
 * Identity of an existing non-raw snippet found by owner and title.
 */
public record EnhancedSnippetRef(long snippetId, long ownerId, String title) {
}
