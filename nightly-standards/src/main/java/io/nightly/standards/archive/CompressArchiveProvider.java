package io.nightly.standards.archive;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import io.nightly.spi.ArchiveException;
import io.nightly.spi.ArchiveFormat;
import io.nightly.spi.ArchiveProvider;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Packs a dump file into a ZIP or TAR archive with Commons Compress. The
 * archive holds one entry named after the source file.
 */
public class CompressArchiveProvider
        implements ArchiveProvider
{
    private static final Logger logger = LoggerFactory.getLogger(CompressArchiveProvider.class);

    @Override
    public void compress(ArchiveFormat format, Path source, Path destination)
        throws ArchiveException
    {
        if (format == ArchiveFormat.NONE) {
            throw new ArchiveException("Archive format 'none' can't be compressed");
        }
        if (!Files.isRegularFile(source)) {
            throw new ArchiveException("Source file does not exist: " + source);
        }
        if (Files.exists(destination)) {
            throw new ArchiveException("Archive already exists: " + destination);
        }

        try (OutputStream out = Files.newOutputStream(destination, CREATE_NEW, WRITE)) {
            switch (format) {
            case ZIP:
                writeZip(source, out);
                break;
            case TAR:
                writeTar(source, out);
                break;
            default:
                throw new ArchiveException("Unsupported archive format: " + format);
            }
        }
        catch (IOException ex) {
            deletePartialArchive(destination);
            throw new ArchiveException("Failed to create " + format + " archive " + destination, ex);
        }
        logger.debug("Packed {} into {}", source.getFileName(), destination.getFileName());
    }

    private static void writeZip(Path source, OutputStream out)
        throws IOException
    {
        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(out)) {
            ZipArchiveEntry entry = new ZipArchiveEntry(source.toFile(), source.getFileName().toString());
            entry.setMethod(ZipArchiveEntry.DEFLATED);
            zip.putArchiveEntry(entry);
            Files.copy(source, zip);
            zip.closeArchiveEntry();
            zip.finish();
        }
    }

    private static void writeTar(Path source, OutputStream out)
        throws IOException
    {
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(out)) {
            // default mode for file names longer than 100 bytes is throwing an exception (LONGFILE_ERROR)
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            TarArchiveEntry entry = new TarArchiveEntry(source.toFile(), source.getFileName().toString());
            tar.putArchiveEntry(entry);
            Files.copy(source, tar);
            tar.closeArchiveEntry();
            tar.finish();
        }
    }

    private static void deletePartialArchive(Path destination)
    {
        try {
            Files.deleteIfExists(destination);
        }
        catch (IOException ex) {
            logger.warn("Failed to delete partial archive {}", destination, ex);
        }
    }
}
