package net.seanstash.domain.snippet;

/**
 * Id of the snippet a candidate resolved to, and whether this call created it.
 */
public record SnippetInsertResult(long snippetId, boolean created) {

    public static SnippetInsertResult created(long snippetId) {
        return new SnippetInsertResult(snippetId, true);
    }

    public static SnippetInsertResult existing(long snippetId) {
        return new SnippetInsertResult(snippetId, false);
    }
}
