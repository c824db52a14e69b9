package io.nightly.spi;

import java.nio.file.Path;

public interface ArchiveProvider
{
    /**
     * Packs the single file at {@code source} into a new archive at {@code destination}.
     *
     * The source file is left in place. A partially written destination is removed
     * before an ArchiveException is thrown.
     */
    void compress(ArchiveFormat format, Path source, Path destination)
        throws ArchiveException;
}
