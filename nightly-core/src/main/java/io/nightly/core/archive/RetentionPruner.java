package io.nightly.core.archive;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.nightly.core.backup.BackupConfig;
import io.nightly.core.repository.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes the oldest artifacts of a job beyond the retention limit of its
 * cadence. Only artifacts of the same job id and cadence are counted.
 */
public class RetentionPruner
{
    private static final Logger logger = LoggerFactory.getLogger(RetentionPruner.class);

    private static class Candidate
    {
        private final Path path;
        private final FileTime modifiedTime;

        Candidate(Path path, FileTime modifiedTime)
        {
            this.path = path;
            this.modifiedTime = modifiedTime;
        }
    }

    private static final Comparator<Candidate> OLDEST_FIRST =
        Comparator.<Candidate, FileTime>comparing(c -> c.modifiedTime)
        .thenComparing(c -> c.path.getFileName().toString());

    private final BackupConfig config;

    @Inject
    public RetentionPruner(BackupConfig config)
    {
        this.config = config;
    }

    /**
     * @return files deleted by this call
     */
    public List<Path> prune(Job job)
    {
        int limit = config.getRetentionLimit(job.getCadence());
        List<Candidate> candidates;
        try {
            candidates = listArtifacts(job);
        }
        catch (IOException ex) {
            logger.warn("Failed to list backups of {} in {}. Pruning is skipped", job.getId(), config.getBackupDir(), ex);
            return ImmutableList.of();
        }
        if (candidates.size() <= limit) {
            return ImmutableList.of();
        }

        candidates.sort(OLDEST_FIRST);
        int excess = candidates.size() - limit;
        ImmutableList.Builder<Path> deleted = ImmutableList.builder();
        for (Candidate candidate : candidates.subList(0, excess)) {
            try {
                Files.delete(candidate.path);
                deleted.add(candidate.path);
                logger.info("Deleted old backup {}", candidate.path.getFileName());
            }
            catch (NoSuchFileException ex) {
                logger.debug("Backup {} is already deleted", candidate.path.getFileName());
            }
            catch (IOException ex) {
                logger.warn("Failed to delete old backup {}. It is retried on the next run", candidate.path, ex);
            }
        }
        return deleted.build();
    }

    private List<Candidate> listArtifacts(Job job)
        throws IOException
    {
        Path dir = config.getBackupDir();
        List<Candidate> candidates = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return candidates;
        }
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
            for (Path path : ds) {
                if (!ArchiveNames.matches(job, path.getFileName().toString()) || !Files.isRegularFile(path)) {
                    continue;
                }
                try {
                    candidates.add(new Candidate(path, Files.getLastModifiedTime(path)));
                }
                catch (NoSuchFileException ex) {
                    // deleted concurrently
                    continue;
                }
            }
        }
        return candidates;
    }
}
