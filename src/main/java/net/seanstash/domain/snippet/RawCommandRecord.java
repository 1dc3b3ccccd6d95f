package net.seanstash.domain.snippet;

import java.time.Instant;

/**
 * Terminal command captured by the CLI and stored before enhancement.
 *
 * <p>Raw records are ordinary snippets carrying the {@link #TITLE_PREFIX} title prefix
 * and the {@link #MARKER_CATEGORY} category.</p>
 */
public record RawCommandRecord(
    long snippetId,
    long ownerId,
    String title,
    String command,
    Instant updatedAt
) {

    public static final String TITLE_PREFIX = "Terminal:";
    public static final String MARKER_CATEGORY = "terminal-commands";
}
