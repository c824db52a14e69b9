package io.nightly.core.backup;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nightly.core.archive.ArchiveNames;
import io.nightly.core.archive.RetentionPruner;
import io.nightly.core.repository.Job;
import io.nightly.core.repository.StorageMode;
import io.nightly.spi.ArchiveException;
import io.nightly.spi.ArchiveFormat;
import io.nightly.spi.ArchiveProvider;
import io.nightly.spi.DumpProvider;
import io.nightly.spi.DumpProviderFactory;
import io.nightly.spi.MailException;
import io.nightly.spi.MailProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Locale.ENGLISH;

/**
 * Runs one backup: dump, archive, then mail or prune.
 *
 * Failures of the database, the archiver and the mailer are logged as
 * warnings and never thrown. A failed archive leaves the plain dump file as
 * the artifact.
 */
public class BackupExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(BackupExecutor.class);

    static final String MAIL_BODY = "Attached is your database backup.";

    private static final DateTimeFormatter MAIL_TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss", ENGLISH);

    private final BackupConfig config;
    private final DumpProviderFactory dumpProviderFactory;
    private final DumpWriter dumpWriter;
    private final ArchiveProvider archiveProvider;
    private final MailProvider mailProvider;
    private final RetentionPruner pruner;
    private final Clock clock;

    @Inject
    public BackupExecutor(
            BackupConfig config,
            DumpProviderFactory dumpProviderFactory,
            DumpWriter dumpWriter,
            ArchiveProvider archiveProvider,
            MailProvider mailProvider,
            RetentionPruner pruner,
            Clock clock)
    {
        this.config = config;
        this.dumpProviderFactory = dumpProviderFactory;
        this.dumpWriter = dumpWriter;
        this.archiveProvider = archiveProvider;
        this.mailProvider = mailProvider;
        this.pruner = pruner;
        this.clock = clock;
    }

    public BackupResult run(Job job)
    {
        LocalDateTime timestamp = LocalDateTime.now(clock);
        String basename = ArchiveNames.basename(job, timestamp);

        ImmutableBackupResult.Builder result = ImmutableBackupResult.builder()
            .jobId(job.getId())
            .archiveFormat(ArchiveFormat.NONE)
            .isMailed(false);

        Optional<Path> artifact = Optional.absent();
        Optional<Path> dumpFile = dump(job, basename);
        if (dumpFile.isPresent()) {
            Path file = archive(job, dumpFile.get());
            artifact = Optional.of(file);
            result.artifact(file);
            if (!file.equals(dumpFile.get())) {
                result.archiveFormat(job.getFormat());
            }
            logger.info("Created backup {} for job {}", file.getFileName(), job.getId());
        }

        if (job.getStorage() == StorageMode.EMAIL) {
            if (artifact.isPresent()) {
                result.isMailed(mail(job, artifact.get(), timestamp));
            }
            else {
                logger.warn("No backup of {} to mail", job.getId());
            }
        }
        else {
            // runs even when the dump failed so that leftovers of earlier failures are bounded
            List<Path> pruned = pruner.prune(job);
            result.prunedFiles(pruned);
        }
        return result.build();
    }

    private Optional<Path> dump(Job job, String basename)
    {
        Path dir = config.getBackupDir();
        Path file = dir.resolve(ArchiveNames.fileName(basename, ArchiveFormat.NONE));
        try {
            Files.createDirectories(dir);
            try (DumpProvider provider = dumpProviderFactory.open()) {
                dumpWriter.write(provider, file);
            }
            return Optional.of(file);
        }
        catch (IOException | RuntimeException ex) {
            logger.warn("Failed to dump database for job {}", job.getId(), ex);
            deleteQuietly(file);
            return Optional.absent();
        }
    }

    private Path archive(Job job, Path dumpFile)
    {
        ArchiveFormat format = job.getFormat();
        if (format == ArchiveFormat.NONE) {
            return dumpFile;
        }
        Path archiveFile = dumpFile.resolveSibling(dumpFile.getFileName().toString() + format.getExtension());
        try {
            archiveProvider.compress(format, dumpFile, archiveFile);
        }
        catch (ArchiveException | RuntimeException ex) {
            logger.warn("Failed to archive {} as {}. Keeping the uncompressed dump", dumpFile.getFileName(), format, ex);
            return dumpFile;
        }
        try {
            Files.delete(dumpFile);
        }
        catch (IOException ex) {
            logger.warn("Failed to delete uncompressed dump {}", dumpFile, ex);
        }
        return archiveFile;
    }

    private boolean mail(Job job, Path artifact, LocalDateTime timestamp)
    {
        if (!job.getEmail().isPresent()) {
            logger.warn("Job {} stores backups by email but has no address", job.getId());
            return false;
        }
        String to = job.getEmail().get();
        String subject = config.getSubjectPrefix() + " - " + MAIL_TIMESTAMP_FORMAT.format(timestamp);
        try {
            mailProvider.send(to, subject, MAIL_BODY, artifact);
            logger.info("Mailed backup {} to {}", artifact.getFileName(), to);
            return true;
        }
        catch (MailException | RuntimeException ex) {
            logger.warn("Failed to mail backup {} to {}", artifact.getFileName(), to, ex);
            return false;
        }
    }

    private static void deleteQuietly(Path file)
    {
        try {
            Files.deleteIfExists(file);
        }
        catch (IOException ex) {
            logger.warn("Failed to delete partial dump {}", file, ex);
        }
    }
}
