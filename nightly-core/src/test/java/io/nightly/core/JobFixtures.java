package io.nightly.core;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import io.nightly.core.repository.Cadence;
import io.nightly.core.repository.ImmutableJobDefinition;
import io.nightly.core.repository.Job;
import io.nightly.core.repository.JobDefinition;
import io.nightly.core.repository.StorageMode;
import io.nightly.spi.ArchiveFormat;

public class JobFixtures
{
    private JobFixtures()
    { }

    public static ImmutableJobDefinition.Builder definition(Cadence cadence, int hour, int minute)
    {
        return JobDefinition.definitionBuilder()
            .title("test " + cadence)
            .cadence(cadence)
            .time(LocalTime.of(hour, minute))
            .storage(StorageMode.SERVER)
            .format(ArchiveFormat.ZIP);
    }

    public static Job dailyJob(String id, int hour, int minute)
    {
        return Job.of(id, definition(Cadence.DAILY, hour, minute).build());
    }

    public static Job weeklyJob(String id, DayOfWeek weekday, int hour, int minute)
    {
        return Job.of(id, definition(Cadence.WEEKLY, hour, minute).weekday(weekday).build());
    }

    public static Job monthlyJob(String id, int dayOfMonth, int hour, int minute)
    {
        return Job.of(id, definition(Cadence.MONTHLY, hour, minute).dayOfMonth(dayOfMonth).build());
    }

    public static Instant utc(String localDateTime)
    {
        return LocalDateTime.parse(localDateTime).toInstant(ZoneOffset.UTC);
    }

    /**
     * A clock that stays where it is put.
     */
    public static class MovableClock
            extends Clock
    {
        private final ZoneId zone;
        private Instant now;

        public MovableClock(Instant now, ZoneId zone)
        {
            this.now = now;
            this.zone = zone;
        }

        public synchronized void advance(Duration duration)
        {
            now = now.plus(duration);
        }

        public synchronized void set(Instant now)
        {
            this.now = now;
        }

        @Override
        public synchronized Instant instant()
        {
            return now;
        }

        @Override
        public ZoneId getZone()
        {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone)
        {
            return new MovableClock(instant(), zone);
        }
    }
}
