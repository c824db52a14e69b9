package io.nightly.core.archive;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.regex.Pattern;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import io.nightly.core.repository.Cadence;
import io.nightly.core.repository.Job;
import io.nightly.spi.ArchiveFormat;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Locale.ENGLISH;

/**
 * Names of backup artifacts.
 *
 * <pre>
 * backup--&lt;job-id&gt;--&lt;cadence&gt;--&lt;YYYY-MM-DD_HH-MM-SS&gt;.sql[.zip|.tar]
 * </pre>
 *
 * The name is the only index of artifacts, so the format must stay
 * compatible with files written by earlier versions.
 */
public class ArchiveNames
{
    public static final String PREFIX = "backup";
    public static final String DELIMITER = "--";
    public static final String DUMP_EXTENSION = ".sql";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd_HH-mm-ss", ENGLISH);

    private static final int TIMESTAMP_LENGTH = "0000-00-00_00-00-00".length();

    private static final Pattern FILE_NAME_CHARS = Pattern.compile("^[A-Za-z0-9_.\\-]+$");

    private static final Splitter DELIMITER_SPLITTER = Splitter.on(DELIMITER);

    private ArchiveNames()
    { }

    public static String basename(String jobId, Cadence cadence, LocalDateTime timestamp)
    {
        checkArgument(!jobId.contains(DELIMITER), "Job id must not contain '%s': %s", DELIMITER, jobId);
        checkArgument(isSafeFileName(jobId) && !jobId.startsWith("-") && !jobId.endsWith("-"),
                "Job id must consist of [A-Za-z0-9_.-] and must not start or end with '-': %s", jobId);
        return PREFIX + DELIMITER + jobId + DELIMITER + cadence.getName() + DELIMITER
            + TIMESTAMP_FORMAT.format(timestamp.truncatedTo(ChronoUnit.SECONDS));
    }

    public static String basename(Job job, LocalDateTime timestamp)
    {
        return basename(job.getId(), job.getCadence(), timestamp);
    }

    public static String fileName(String basename, ArchiveFormat format)
    {
        return basename + DUMP_EXTENSION + format.getExtension();
    }

    /**
     * Returns true if the name belongs to the job's artifacts. Any name
     * {@code backup--<id>--<cadence>--*.sql*} matches, including plain .sql
     * files left over when archiving failed.
     */
    public static boolean matches(Job job, String fileName)
    {
        String prefix = PREFIX + DELIMITER + job.getId() + DELIMITER + job.getCadence().getName() + DELIMITER;
        if (!fileName.startsWith(prefix)) {
            return false;
        }
        return fileName.indexOf(DUMP_EXTENSION, prefix.length()) >= 0;
    }

    /**
     * Returns true if the name consists only of {@code [A-Za-z0-9_.-]}.
     */
    public static boolean isSafeFileName(String fileName)
    {
        return FILE_NAME_CHARS.matcher(fileName).matches();
    }

    public static Optional<ArchiveName> parse(String fileName)
    {
        if (!isSafeFileName(fileName)) {
            return Optional.absent();
        }
        List<String> fields = DELIMITER_SPLITTER.splitToList(fileName);
        if (fields.size() != 4 || !fields.get(0).equals(PREFIX) || fields.get(1).isEmpty()) {
            return Optional.absent();
        }

        Cadence cadence;
        try {
            cadence = Cadence.of(fields.get(2));
        }
        catch (IllegalArgumentException ex) {
            return Optional.absent();
        }

        String rest = fields.get(3);
        if (rest.length() < TIMESTAMP_LENGTH) {
            return Optional.absent();
        }
        LocalDateTime timestamp;
        try {
            timestamp = LocalDateTime.parse(rest.substring(0, TIMESTAMP_LENGTH), TIMESTAMP_FORMAT);
        }
        catch (DateTimeParseException ex) {
            return Optional.absent();
        }

        Optional<ArchiveFormat> format = formatOf(rest.substring(TIMESTAMP_LENGTH));
        if (!format.isPresent()) {
            return Optional.absent();
        }
        return Optional.of(ArchiveName.of(fields.get(1), cadence, timestamp, format.get()));
    }

    private static Optional<ArchiveFormat> formatOf(String extension)
    {
        for (ArchiveFormat format : ArchiveFormat.values()) {
            if (extension.equals(DUMP_EXTENSION + format.getExtension())) {
                return Optional.of(format);
            }
        }
        return Optional.absent();
    }
}
