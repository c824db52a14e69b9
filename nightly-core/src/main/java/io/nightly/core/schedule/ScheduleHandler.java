package io.nightly.core.schedule;

import java.time.Duration;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nightly.core.backup.BackupExecutor;
import io.nightly.core.backup.BackupResult;
import io.nightly.core.repository.Job;
import io.nightly.core.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one firing of a job.
 */
public class ScheduleHandler
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleHandler.class);

    static final Duration LOCK_TTL = Duration.ofMinutes(5);

    private final ExecutionLock lock;
    private final JobStore jobStore;
    private final BackupExecutor executor;

    @Inject
    public ScheduleHandler(ExecutionLock lock, JobStore jobStore, BackupExecutor executor)
    {
        this.lock = lock;
        this.jobStore = jobStore;
        this.executor = executor;
    }

    /**
     * Runs a backup of the job unless the same job already started within
     * the lock ttl or the job no longer exists.
     *
     * @return the job as it was stored when the backup ran, or absent if this
     *         firing was dropped. A dropped firing must not be re-armed.
     */
    public Optional<Job> fire(String jobId)
    {
        if (!lock.tryAcquire(jobId, LOCK_TTL)) {
            logger.debug("Backup of {} is already running. Dropping duplicated firing", jobId);
            return Optional.absent();
        }

        Optional<Job> job = jobStore.getJobById(jobId);
        if (!job.isPresent()) {
            logger.info("Job {} was deleted before its backup started. Dropping firing", jobId);
            return Optional.absent();
        }

        try {
            BackupResult result = executor.run(job.get());
            logger.info("Backup of {} finished: {}", jobId, result);
        }
        catch (RuntimeException ex) {
            logger.error("Backup of {} failed", jobId, ex);
        }
        return job;
    }
}
