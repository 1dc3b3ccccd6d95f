package net.seanstash.application.ai;

import java.util.List;
import net.seanstash.util.HashUtils;

/**
 * Computes content digests for command batches.
 *
 * <p>The batch digest is order-sensitive: prompts number commands by position, so a
 * reordered batch is a different request. A single command hashes exactly like a
 * batch of one, which lets processed-command marks share the cache's hashing.</p>
 */
public final class CommandBatchHasher {

    static final String SEPARATOR = "|";

    private CommandBatchHasher() {
    }

    /**
     * Returns the lowercase SHA-256 hex digest of the {@code |}-joined commands.
     *
     * @throws IllegalArgumentException when the batch is null or empty
     */
    public static String digest(List<String> commands) {
        if (commands == null || commands.isEmpty()) {
            throw new IllegalArgumentException("Command batch must contain at least one command");
        }
        return HashUtils.sha256Hex(String.join(SEPARATOR, commands));
    }

    public static String digest(String command) {
        if (command == null) {
            throw new IllegalArgumentException("Command must not be null");
        }
        return HashUtils.sha256Hex(command);
    }
}
