package io.nightly.core.schedule;

import java.time.Duration;

/**
 * Short-lived lock that collapses duplicate deliveries of the same firing.
 *
 * A held lock is never released explicitly. It expires when its ttl elapses,
 * so a crashed run blocks retries at most for the ttl.
 */
public interface ExecutionLock
{
    /**
     * Returns true if the key was free or its previous holder expired.
     * Returns false if the key is held and unexpired.
     */
    boolean tryAcquire(String key, Duration ttl);
}
