package net.seanstash.support.retry;

/**
 * Signals that a transaction-scoped advisory lock was held by another session.
 */
public class AdvisoryLockAcquisitionException extends IllegalStateException {

    private final long lockKey;

    public AdvisoryLockAcquisitionException(String resource, long lockKey) {
        super("Unable to acquire advisory lock for " + resource + " (lockKey=" + lockKey + ")");
        this.lockKey = lockKey;
    }

    public long getLockKey() {
        return lockKey;
    }
}
