package io.nightly.core.backup;

import java.nio.file.Path;
import java.util.List;
import org.immutables.value.Value;
import com.google.common.base.Optional;
import io.nightly.spi.ArchiveFormat;

@Value.Immutable
public abstract class BackupResult
{
    public abstract String getJobId();

    /**
     * The file left by this run. Absent if the dump failed.
     */
    public abstract Optional<Path> getArtifact();

    /**
     * Format of the artifact. NONE if archiving was not requested or failed.
     */
    public abstract ArchiveFormat getArchiveFormat();

    public abstract boolean isMailed();

    public abstract List<Path> getPrunedFiles();

    public boolean isSucceeded()
    {
        return getArtifact().isPresent();
    }
}
