package io.nightly.core.archive;

import java.time.Instant;
import org.immutables.value.Value;

@Value.Immutable
public abstract class BackupFile
{
    public abstract String getFileName();

    public abstract ArchiveName getName();

    /**
     * Storage mode of the job that wrote this file, or "Unknown" if the
     * job no longer exists.
     */
    public abstract String getStorage();

    public abstract Instant getModifiedAt();

    public abstract long getSize();
}
