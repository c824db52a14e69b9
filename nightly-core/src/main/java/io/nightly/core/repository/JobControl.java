package io.nightly.core.repository;

import java.time.Clock;
import java.util.List;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nightly.core.schedule.BackupScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validated create, update and delete of jobs, keeping the scheduler in
 * step with the store. A new or edited job is armed for its next run and
 * never runs immediately.
 */
public class JobControl
{
    private static final Logger logger = LoggerFactory.getLogger(JobControl.class);

    private final JobStore store;
    private final BackupScheduler scheduler;
    private final Clock clock;

    @Inject
    public JobControl(JobStore store, BackupScheduler scheduler, Clock clock)
    {
        this.store = store;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public List<Job> getJobs()
    {
        return store.getJobs();
    }

    public Job getJob(String id)
        throws ResourceNotFoundException
    {
        Optional<Job> job = store.getJobById(id);
        if (!job.isPresent()) {
            throw new ResourceNotFoundException("Job not found: " + id);
        }
        return job.get();
    }

    public Job addJob(JobDefinition def)
    {
        validate(def);
        Job job = Job.of(JobIds.generate(clock.instant()), def);
        store.putJob(job);
        logger.info("Added job {} ({})", job.getId(), job.getTitle());
        scheduler.schedule(job);
        return job;
    }

    public Job updateJob(String id, JobDefinition def)
        throws ResourceNotFoundException
    {
        validate(def);
        getJob(id);
        Job job = Job.of(id, def);
        scheduler.unschedule(id);
        store.putJob(job);
        logger.info("Updated job {} ({})", job.getId(), job.getTitle());
        scheduler.schedule(job);
        return job;
    }

    public Job deleteJob(String id)
        throws ResourceNotFoundException
    {
        Job job = getJob(id);
        scheduler.unschedule(id);
        if (!store.deleteJob(id)) {
            throw new ResourceNotFoundException("Job not found: " + id);
        }
        // a re-arm may have run between the two calls above
        scheduler.unschedule(id);
        logger.info("Deleted job {} ({})", job.getId(), job.getTitle());
        return job;
    }

    private static void validate(JobDefinition def)
    {
        ModelValidator.builder()
            .checkJobDefinition(def)
            .validate("job", def);
    }
}
