package io.nightly.core.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nightly.core.backup.BackupConfig;
import io.nightly.core.repository.Job;
import io.nightly.core.repository.JobStore;
import io.nightly.core.repository.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists, reads and deletes artifacts in the backup directory.
 *
 * File names given by callers are checked before any file system access:
 * only names that consist of {@code [A-Za-z0-9_.-]} and parse as an
 * archive name are accepted.
 */
public class BackupFileManager
{
    private static final Logger logger = LoggerFactory.getLogger(BackupFileManager.class);

    public static final String UNKNOWN_STORAGE = "Unknown";

    private final BackupConfig config;
    private final JobStore jobStore;

    @Inject
    public BackupFileManager(BackupConfig config, JobStore jobStore)
    {
        this.config = config;
        this.jobStore = jobStore;
    }

    /**
     * Returns artifacts of all jobs, newest first.
     */
    public List<BackupFile> listFiles()
        throws IOException
    {
        Path dir = config.getBackupDir();
        List<BackupFile> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }

        Map<String, String> storageOfJobs = new HashMap<>();
        for (Job job : jobStore.getJobs()) {
            storageOfJobs.put(job.getId(), job.getStorage().getName());
        }

        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, ArchiveNames.PREFIX + ArchiveNames.DELIMITER + "*")) {
            for (Path path : ds) {
                String fileName = path.getFileName().toString();
                Optional<ArchiveName> name = ArchiveNames.parse(fileName);
                if (!name.isPresent()) {
                    continue;
                }
                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(path, BasicFileAttributes.class);
                }
                catch (NoSuchFileException ex) {
                    logger.debug("Backup {} was deleted while listing", fileName);
                    continue;
                }
                if (!attrs.isRegularFile()) {
                    continue;
                }
                String storage = storageOfJobs.get(name.get().getJobId());
                files.add(ImmutableBackupFile.builder()
                        .fileName(fileName)
                        .name(name.get())
                        .storage(storage == null ? UNKNOWN_STORAGE : storage)
                        .modifiedAt(attrs.lastModifiedTime().toInstant())
                        .size(attrs.size())
                        .build());
            }
        }
        files.sort(Comparator.comparing(BackupFile::getModifiedAt).reversed()
                .thenComparing(BackupFile::getFileName));
        return files;
    }

    /**
     * Opens an artifact for download. The caller closes the stream.
     */
    public InputStream openFile(String fileName)
        throws ResourceNotFoundException, IOException
    {
        Path path = resolve(fileName);
        try {
            return Files.newInputStream(path);
        }
        catch (NoSuchFileException ex) {
            throw new ResourceNotFoundException("Backup file not found: " + fileName, ex);
        }
    }

    public long getFileSize(String fileName)
        throws ResourceNotFoundException, IOException
    {
        Path path = resolve(fileName);
        try {
            return Files.size(path);
        }
        catch (NoSuchFileException ex) {
            throw new ResourceNotFoundException("Backup file not found: " + fileName, ex);
        }
    }

    public void deleteFile(String fileName)
        throws ResourceNotFoundException, IOException
    {
        Path path = resolve(fileName);
        try {
            Files.delete(path);
        }
        catch (NoSuchFileException ex) {
            throw new ResourceNotFoundException("Backup file not found: " + fileName, ex);
        }
        logger.info("Deleted backup {}", fileName);
    }

    private Path resolve(String fileName)
    {
        if (!ArchiveNames.isSafeFileName(fileName) || !ArchiveNames.parse(fileName).isPresent()) {
            throw new IllegalArgumentException("Invalid backup file name: " + fileName);
        }
        Path dir = config.getBackupDir().toAbsolutePath().normalize();
        Path path = dir.resolve(fileName).normalize();
        if (!dir.equals(path.getParent())) {
            throw new IllegalArgumentException("Invalid backup file name: " + fileName);
        }
        return path;
    }
}
