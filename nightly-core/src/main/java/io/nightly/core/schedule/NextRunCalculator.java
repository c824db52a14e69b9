package io.nightly.core.schedule;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import com.google.inject.Inject;
import io.nightly.core.repository.JobDefinition;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Computes when a job fires next.
 *
 * Dates are evaluated in the zone of the injected clock. Days are calendar
 * days, so a daily job keeps its wall-clock time across daylight saving
 * changes.
 */
public class NextRunCalculator
{
    private final ZoneId zone;

    @Inject
    public NextRunCalculator(Clock clock)
    {
        this(clock.getZone());
    }

    public NextRunCalculator(ZoneId zone)
    {
        this.zone = zone;
    }

    public ZoneId getZone()
    {
        return zone;
    }

    /**
     * Returns the first run time of the job that is strictly after {@code now}.
     */
    public Instant computeNextRun(JobDefinition job, Instant now)
    {
        LocalDate today = now.atZone(zone).toLocalDate();
        switch (job.getCadence()) {
        case DAILY:
            {
                ZonedDateTime run = at(job, today);
                if (!run.toInstant().isAfter(now)) {
                    run = at(job, today.plusDays(1));
                }
                return run.toInstant();
            }
        case WEEKLY:
            {
                DayOfWeek target = weekdayOf(job);
                int days = (target.getValue() - today.getDayOfWeek().getValue() + 7) % 7;
                ZonedDateTime run = at(job, today.plusDays(days));
                if (days == 0 && !run.toInstant().isAfter(now)) {
                    run = at(job, today.plusDays(7));
                }
                return run.toInstant();
            }
        case MONTHLY:
            {
                YearMonth month = YearMonth.from(today);
                ZonedDateTime run = at(job, dayInMonth(job, month));
                if (!run.toInstant().isAfter(now)) {
                    run = at(job, dayInMonth(job, month.plusMonths(1)));
                }
                return run.toInstant();
            }
        default:
            throw new IllegalArgumentException("Unknown cadence: " + job.getCadence());
        }
    }

    /**
     * Returns the run time one cadence period after {@code runTime}: the next
     * day, the same weekday of the next week, or the configured day of the
     * next month.
     */
    public Instant advance(JobDefinition job, Instant runTime)
    {
        LocalDate date = runTime.atZone(zone).toLocalDate();
        switch (job.getCadence()) {
        case DAILY:
            return at(job, date.plusDays(1)).toInstant();
        case WEEKLY:
            return at(job, date.plusDays(7)).toInstant();
        case MONTHLY:
            return at(job, dayInMonth(job, YearMonth.from(date).plusMonths(1))).toInstant();
        default:
            throw new IllegalArgumentException("Unknown cadence: " + job.getCadence());
        }
    }

    private ZonedDateTime at(JobDefinition job, LocalDate date)
    {
        return date.atTime(job.getTime()).atZone(zone);
    }

    private static DayOfWeek weekdayOf(JobDefinition job)
    {
        checkArgument(job.getWeekday().isPresent(), "A weekly job needs a weekday");
        return job.getWeekday().get();
    }

    // clamps to the last day of shorter months
    private static LocalDate dayInMonth(JobDefinition job, YearMonth month)
    {
        checkArgument(job.getDayOfMonth().isPresent(), "A monthly job needs a day of month");
        int day = job.getDayOfMonth().get();
        checkArgument(day >= 1 && day <= 31, "Day of month must be between 1 and 31 but got %s", day);
        return month.atDay(Math.min(day, month.lengthOfMonth()));
    }
}
