package net.seanstash.application.enhancement;

import java.time.Duration;

/**
 * Cross-instance lock that keeps at most one enhancement pass running per deployment.
 */
public interface EnhancementPassLock {

    /**
     * @return true when the caller now holds the lease until {@code leaseDuration} elapses
     */
    boolean tryAcquire(String holderId, Duration leaseDuration);

    void release(String holderId);
}
