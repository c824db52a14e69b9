package io.nightly.cli;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import static io.nightly.cli.SystemExitException.systemExit;
import static java.util.Locale.ENGLISH;

public class TimeUtil
{
    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss Z", ENGLISH);

    private static final DateTimeFormatter TIME_OF_DAY_PARSER =
            DateTimeFormatter.ofPattern("H:mm", ENGLISH);

    private TimeUtil()
    { }

    public static String formatTime(Instant instant, ZoneId zone)
    {
        return FORMATTER.withZone(zone).format(instant);
    }

    public static LocalTime parseTimeOfDay(String s, String errorMessage)
            throws SystemExitException
    {
        try {
            return LocalTime.parse(s.trim(), TIME_OF_DAY_PARSER);
        }
        catch (DateTimeParseException ex) {
            throw systemExit(errorMessage + ": " + s);
        }
    }

    public static String formatSize(long bytes)
    {
        if (bytes < 1024) {
            return bytes + " B";
        }
        else if (bytes < 1024 * 1024) {
            return String.format(ENGLISH, "%.1f KB", bytes / 1024.0);
        }
        else if (bytes < 1024L * 1024 * 1024) {
            return String.format(ENGLISH, "%.1f MB", bytes / (1024.0 * 1024));
        }
        else {
            return String.format(ENGLISH, "%.1f GB", bytes / (1024.0 * 1024 * 1024));
        }
    }
}
