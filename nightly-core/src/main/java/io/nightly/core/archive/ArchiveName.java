package io.nightly.core.archive;

import java.time.LocalDateTime;
import org.immutables.value.Value;
import io.nightly.core.repository.Cadence;
import io.nightly.spi.ArchiveFormat;

@Value.Immutable
public abstract class ArchiveName
{
    public abstract String getJobId();

    public abstract Cadence getCadence();

    /**
     * Local time of the backup in the scheduler's zone, second precision.
     */
    public abstract LocalDateTime getTimestamp();

    /**
     * NONE for a plain .sql file.
     */
    public abstract ArchiveFormat getFormat();

    public String getBasename()
    {
        return ArchiveNames.basename(getJobId(), getCadence(), getTimestamp());
    }

    public String getFileName()
    {
        return ArchiveNames.fileName(getBasename(), getFormat());
    }

    public static ArchiveName of(String jobId, Cadence cadence, LocalDateTime timestamp, ArchiveFormat format)
    {
        return ImmutableArchiveName.builder()
            .jobId(jobId)
            .cadence(cadence)
            .timestamp(timestamp)
            .format(format)
            .build();
    }
}
