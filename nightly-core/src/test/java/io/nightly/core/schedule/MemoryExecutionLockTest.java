package io.nightly.core.schedule;

import java.time.Duration;
import io.nightly.core.JobFixtures.MovableClock;
import org.junit.Test;

import static io.nightly.core.JobFixtures.utc;
import static java.time.ZoneOffset.UTC;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class MemoryExecutionLockTest
{
    private final MovableClock clock = new MovableClock(utc("2024-01-10T00:00:00"), UTC);
    private final MemoryExecutionLock lock = new MemoryExecutionLock(clock);

    @Test
    public void heldKeyIsNotAcquiredAgain()
    {
        assertThat(lock.tryAcquire("job_1", Duration.ofMinutes(5)), is(true));
        assertThat(lock.tryAcquire("job_1", Duration.ofMinutes(5)), is(false));
    }

    @Test
    public void keysAreIndependent()
    {
        assertThat(lock.tryAcquire("job_1", Duration.ofMinutes(5)), is(true));
        assertThat(lock.tryAcquire("job_2", Duration.ofMinutes(5)), is(true));
    }

    @Test
    public void expiredKeyIsAcquired()
    {
        assertThat(lock.tryAcquire("job_1", Duration.ofMinutes(5)), is(true));
        clock.advance(Duration.ofMinutes(5).minusSeconds(1));
        assertThat(lock.tryAcquire("job_1", Duration.ofMinutes(5)), is(false));
        clock.advance(Duration.ofSeconds(1));
        assertThat(lock.tryAcquire("job_1", Duration.ofMinutes(5)), is(true));
        assertThat(lock.tryAcquire("job_1", Duration.ofMinutes(5)), is(false));
    }

    @Test
    public void failedAttemptDoesNotExtendLock()
    {
        assertThat(lock.tryAcquire("job_1", Duration.ofMinutes(5)), is(true));
        clock.advance(Duration.ofMinutes(3));
        assertThat(lock.tryAcquire("job_1", Duration.ofMinutes(5)), is(false));
        clock.advance(Duration.ofMinutes(2));
        assertThat(lock.tryAcquire("job_1", Duration.ofMinutes(5)), is(true));
    }

    @Test
    public void expiredKeysAreForgotten()
    {
        assertThat(lock.tryAcquire("job_1", Duration.ofMinutes(5)), is(true));
        clock.advance(Duration.ofMinutes(6));
        assertThat(lock.tryAcquire("job_2", Duration.ofMinutes(5)), is(true));
        assertThat(lock.size(), is(1));
        assertThat(lock.tryAcquire("job_1", Duration.ofMinutes(5)), is(true));
        assertThat(lock.size(), is(2));
    }
}
