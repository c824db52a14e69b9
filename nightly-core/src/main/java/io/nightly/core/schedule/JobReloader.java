package io.nightly.core.schedule;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.nightly.core.repository.Job;
import io.nightly.core.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the job store and re-arms jobs that were added, changed or removed
 * by another process, such as the command line tool editing the job file.
 */
public class JobReloader
{
    private static final Logger logger = LoggerFactory.getLogger(JobReloader.class);

    private final JobStore jobStore;
    private final BackupScheduler scheduler;
    private final ScheduleConfig config;
    private final Map<String, Job> lastSeen = new HashMap<>();
    private ScheduledExecutorService executor = null;

    @Inject
    public JobReloader(JobStore jobStore, BackupScheduler scheduler, ScheduleConfig config)
    {
        this.jobStore = jobStore;
        this.scheduler = scheduler;
        this.config = config;
    }

    public synchronized void start()
    {
        int interval = config.getReloadInterval();
        if (interval == 0) {
            logger.debug("Job reloading is disabled.");
            return;
        }
        if (executor == null) {
            remember(jobStore.getJobs());
            ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("job-reloader-%d")
                    .build()
                    );
            executor.scheduleWithFixedDelay(() -> backgroundReload(), interval, interval, TimeUnit.SECONDS);
            this.executor = executor;
        }
    }

    public synchronized void shutdown()
    {
        if (executor != null) {
            executor.shutdown();
            executor = null;
        }
    }

    private void backgroundReload()
    {
        try {
            reloadOnce();
        }
        catch (Throwable t) {
            logger.error("An uncaught exception is ignored. Reloading will be retried.", t);
        }
    }

    @VisibleForTesting
    synchronized void reloadOnce()
    {
        List<Job> jobs = jobStore.getJobs();
        for (Job job : jobs) {
            Job last = lastSeen.get(job.getId());
            if (job.equals(last)) {
                continue;
            }
            if (last == null) {
                logger.info("Found new job {}", job.getId());
            }
            else {
                logger.info("Reloading changed job {}", job.getId());
            }
            try {
                scheduler.schedule(job);
            }
            catch (RuntimeException ex) {
                logger.error("Failed to schedule backup of {}", job.getId(), ex);
            }
        }

        ImmutableSet.Builder<String> ids = ImmutableSet.builder();
        for (Job job : jobs) {
            ids.add(job.getId());
        }
        ImmutableSet<String> current = ids.build();
        for (String id : ImmutableSet.copyOf(lastSeen.keySet())) {
            if (!current.contains(id)) {
                logger.info("Job {} was removed", id);
                scheduler.unschedule(id);
            }
        }
        remember(jobs);
    }

    private void remember(List<Job> jobs)
    {
        lastSeen.clear();
        for (Job job : jobs) {
            lastSeen.put(job.getId(), job);
        }
    }
}
