package io.nightly.cli;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import com.beust.jcommander.Parameter;
import com.google.common.base.Optional;
import io.nightly.core.repository.Cadence;
import io.nightly.core.repository.ImmutableJobDefinition;
import io.nightly.core.repository.Job;
import io.nightly.core.repository.StorageMode;
import io.nightly.spi.ArchiveFormat;

import static io.nightly.cli.SystemExitException.systemExit;
import static java.util.Locale.ENGLISH;

/**
 * Options shared by commands that create or change a job.
 */
public abstract class JobCommand
    extends Command
{
    @Parameter(names = {"--title"})
    String title = null;

    @Parameter(names = {"--cadence"})
    String cadence = null;

    @Parameter(names = {"--time"})
    String time = null;

    @Parameter(names = {"--weekday"})
    String weekday = null;

    @Parameter(names = {"--day"})
    Integer dayOfMonth = null;

    @Parameter(names = {"--storage"})
    String storage = null;

    @Parameter(names = {"--format"})
    String format = null;

    @Parameter(names = {"--email"})
    String email = null;

    /**
     * Overwrites attributes of the builder with the options given on the
     * command line. Options not given are left unchanged.
     */
    protected ImmutableJobDefinition.Builder applyOptions(ImmutableJobDefinition.Builder builder)
        throws SystemExitException
    {
        if (title != null) {
            builder.title(title);
        }
        if (cadence != null) {
            builder.cadence(parseEnum(() -> Cadence.of(cadence), "--cadence must be daily, weekly or monthly", cadence));
        }
        if (time != null) {
            builder.time(TimeUtil.parseTimeOfDay(time, "--time must be HH:MM"));
        }
        if (weekday != null) {
            builder.weekday(parseEnum(() -> DayOfWeek.valueOf(weekday.trim().toUpperCase(ENGLISH)), "--weekday must be a day name such as MONDAY", weekday));
        }
        if (dayOfMonth != null) {
            builder.dayOfMonth(dayOfMonth);
        }
        if (storage != null) {
            builder.storage(parseEnum(() -> StorageMode.of(storage), "--storage must be server or email", storage));
        }
        if (format != null) {
            builder.format(parseEnum(() -> ArchiveFormat.of(format), "--format must be zip, tar or none", format));
        }
        if (email != null) {
            if (email.trim().isEmpty()) {
                builder.email(Optional.absent());
            }
            else {
                builder.email(email.trim());
            }
        }
        return builder;
    }

    private interface EnumParser<E>
    {
        E parse();
    }

    private static <E> E parseEnum(EnumParser<E> parser, String errorMessage, String value)
        throws SystemExitException
    {
        try {
            return parser.parse();
        }
        catch (IllegalArgumentException ex) {
            throw systemExit(errorMessage + ": " + value);
        }
    }

    protected void showJobOptions()
    {
        err.println("        --title TEXT                 name of the job");
        err.println("        --cadence daily|weekly|monthly");
        err.println("        --time HH:MM                 time of day to run");
        err.println("        --weekday DAY                day of week of a weekly job (MONDAY..SUNDAY)");
        err.println("        --day N                      day of month of a monthly job (1-31)");
        err.println("        --storage server|email       keep backups on this server or mail them (default: server)");
        err.println("        --format zip|tar|none        archive format (default: zip)");
        err.println("        --email ADDRESS              recipient of email storage");
    }

    protected void showJob(Job job, Instant nextRun, ZoneId zone)
    {
        ln("  id: %s", job.getId());
        ln("  title: %s", job.getTitle());
        ln("  schedule: %s", describeSchedule(job));
        ln("  storage: %s", job.getStorage());
        if (job.getEmail().isPresent()) {
            ln("  email: %s", job.getEmail().get());
        }
        ln("  format: %s", job.getFormat());
        ln("  next run: %s", TimeUtil.formatTime(nextRun, zone));
    }

    static String describeSchedule(Job job)
    {
        String hhmm = String.format(ENGLISH, "%02d:%02d", job.getTime().getHour(), job.getTime().getMinute());
        switch (job.getCadence()) {
        case WEEKLY:
            return "weekly on " + job.getWeekday().transform(DayOfWeek::toString).or("?") + " at " + hhmm;
        case MONTHLY:
            return "monthly on day " + job.getDayOfMonth().transform(day -> Integer.toString(day)).or("?") + " at " + hhmm;
        default:
            return "daily at " + hhmm;
        }
    }
}
