package io.nightly.core.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;

public class MemoryExecutionLock
        implements ExecutionLock
{
    private final Clock clock;
    private final ConcurrentMap<String, Instant> expirations = new ConcurrentHashMap<>();

    @Inject
    public MemoryExecutionLock(Clock clock)
    {
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String key, Duration ttl)
    {
        Instant now = clock.instant();
        // expired keys of deleted jobs would otherwise stay forever
        expirations.values().removeIf(expiry -> !expiry.isAfter(now));
        AtomicBoolean acquired = new AtomicBoolean(false);
        expirations.compute(key, (k, current) -> {
            if (current != null && current.isAfter(now)) {
                return current;
            }
            acquired.set(true);
            return now.plus(ttl);
        });
        return acquired.get();
    }

    @VisibleForTesting
    int size()
    {
        return expirations.size();
    }
}
