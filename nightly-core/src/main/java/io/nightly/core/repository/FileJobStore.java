package io.nightly.core.repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.nightly.core.config.ThrowablesUtil;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * JobStore backed by a JSON array file.
 *
 * The file is read again on every call so that edits made by another
 * process (the command line tool, for example) are visible to the scheduler.
 * Writes go to a temporary file in the same directory which is then moved
 * over the original.
 */
public class FileJobStore
        implements JobStore
{
    private static final Logger logger = LoggerFactory.getLogger(FileJobStore.class);

    private static final TypeReference<List<Job>> JOB_LIST = new TypeReference<List<Job>>() {};

    private final ObjectMapper mapper;
    private final Path path;

    public FileJobStore(ObjectMapper mapper, Path path)
    {
        this.mapper = mapper;
        this.path = path.toAbsolutePath();
    }

    public Path getPath()
    {
        return path;
    }

    @Override
    public synchronized List<Job> getJobs()
    {
        return ImmutableList.copyOf(readJobs());
    }

    @Override
    public synchronized Optional<Job> getJobById(String id)
    {
        return JobLists.find(readJobs(), id);
    }

    @Override
    public synchronized void putJob(Job job)
    {
        List<Job> jobs = readJobs();
        JobLists.put(jobs, job);
        writeJobs(jobs);
    }

    @Override
    public synchronized boolean deleteJob(String id)
    {
        List<Job> jobs = readJobs();
        if (!JobLists.remove(jobs, id)) {
            return false;
        }
        writeJobs(jobs);
        return true;
    }

    private List<Job> readJobs()
    {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        try (InputStream in = Files.newInputStream(path)) {
            List<Job> jobs = mapper.readValue(in, JOB_LIST);
            return jobs == null ? new ArrayList<>() : new ArrayList<>(jobs);
        }
        catch (IOException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
    }

    private void writeJobs(List<Job> jobs)
    {
        try {
            Path dir = path.getParent();
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            try {
                try (OutputStream out = Files.newOutputStream(temp)) {
                    mapper.writerFor(JOB_LIST)
                        .withDefaultPrettyPrinter()
                        .writeValue(out, jobs);
                }
                moveIntoPlace(temp);
            }
            finally {
                Files.deleteIfExists(temp);
            }
        }
        catch (IOException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
        logger.debug("Wrote {} jobs to {}", jobs.size(), path);
    }

    private void moveIntoPlace(Path temp)
        throws IOException
    {
        try {
            Files.move(temp, path, ATOMIC_MOVE, REPLACE_EXISTING);
        }
        catch (AtomicMoveNotSupportedException ex) {
            logger.debug("Atomic move is not supported on {}. Falling back to replace", path.getParent());
            Files.move(temp, path, REPLACE_EXISTING);
        }
    }
}
