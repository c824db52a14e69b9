package io.nightly.core.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.nightly.core.repository.Job;
import io.nightly.core.repository.JobDefinition;
import io.nightly.core.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Keeps exactly one one-shot timer per scheduled job.
 *
 * When a timer elapses the backup runs on a worker thread and the job is
 * re-armed from its latest stored definition afterwards, whether the backup
 * succeeded or not. Timers live only in memory; {@link #start()} rebuilds
 * them from the job store.
 */
public class BackupScheduler
{
    private static final Logger logger = LoggerFactory.getLogger(BackupScheduler.class);

    static final Duration GUARD_BAND = Duration.ofMinutes(30);
    static final Duration MINIMUM_DELAY = Duration.ofMinutes(5);
    static final Duration REARM_RETRY_INTERVAL = Duration.ofMinutes(1);

    private static class Timer
    {
        private final String jobId;
        private final Instant time;
        private final boolean rearmOnly;
        private ScheduledFuture<?> future;

        Timer(String jobId, Instant time, boolean rearmOnly)
        {
            this.jobId = jobId;
            this.time = time;
            this.rearmOnly = rearmOnly;
        }
    }

    private final JobStore jobStore;
    private final NextRunCalculator calculator;
    private final ScheduleHandler handler;
    private final ScheduleConfig config;
    private final Clock clock;

    // guarded by this
    private final Map<String, Timer> timers = new HashMap<>();
    private ScheduledExecutorService timerExecutor;
    private ExecutorService workers;

    @Inject
    public BackupScheduler(
            JobStore jobStore,
            NextRunCalculator calculator,
            ScheduleHandler handler,
            ScheduleConfig config,
            Clock clock)
    {
        this.jobStore = jobStore;
        this.calculator = calculator;
        this.handler = handler;
        this.config = config;
        this.clock = clock;
    }

    @VisibleForTesting
    BackupScheduler(
            JobStore jobStore,
            NextRunCalculator calculator,
            ScheduleHandler handler,
            ScheduleConfig config,
            Clock clock,
            ScheduledExecutorService timerExecutor,
            ExecutorService workers)
    {
        this(jobStore, calculator, handler, config, clock);
        this.timerExecutor = timerExecutor;
        this.workers = workers;
    }

    public synchronized boolean isStarted()
    {
        return timerExecutor != null;
    }

    /**
     * Starts the timer and worker threads and arms every stored job.
     */
    public synchronized void start()
    {
        if (!config.getEnabled()) {
            logger.debug("Scheduler is disabled.");
            return;
        }
        if (timerExecutor == null) {
            timerExecutor = Executors.newScheduledThreadPool(1,
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("backup-scheduler-%d")
                    .build()
                    );
            workers = Executors.newFixedThreadPool(config.getMaxWorkers(),
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("backup-worker-%d")
                    .build()
                    );
        }
        for (Job job : jobStore.getJobs()) {
            try {
                schedule(job);
            }
            catch (RuntimeException ex) {
                logger.error("Failed to schedule backup of {}. The job is skipped until it is edited.", job.getId(), ex);
            }
        }
    }

    /**
     * Cancels every timer and stops the threads. Backups already running
     * are not interrupted.
     */
    public synchronized void shutdown()
    {
        try {
            for (Job job : jobStore.getJobs()) {
                unschedule(job.getId());
            }
        }
        catch (RuntimeException ex) {
            logger.warn("Failed to read jobs while shutting down scheduler. Cancelling all timers", ex);
        }
        for (String jobId : ImmutableList.copyOf(timers.keySet())) {
            unschedule(jobId);
        }
        if (timerExecutor != null) {
            timerExecutor.shutdown();
            workers.shutdown();
            timerExecutor = null;
            workers = null;
        }
    }

    /**
     * Cancels the current timer of the job if any and arms a new one.
     *
     * The new firing is never sooner than 5 minutes from now. A run time
     * within 30 minutes from now is moved one cadence period later.
     *
     * @return time of the new firing
     */
    public synchronized Instant schedule(Job job)
    {
        cancel(job.getId());

        Instant now = clock.instant();
        Instant next = computeFiringTime(job, now);
        if (timerExecutor == null) {
            logger.debug("Scheduler is not running. Backup of {} is not armed (next run would be {})", job.getId(), next);
            return next;
        }

        Timer timer = new Timer(job.getId(), next, false);
        if (arm(timer, Duration.between(now, next))) {
            logger.info("Scheduled backup of {} ({}) at {}", job.getId(), job.getCadence(), next);
        }
        return next;
    }

    /**
     * Cancels the timer of the job. No firing of the job happens after
     * this method returns except one that was already running.
     *
     * @return false if the job had no timer
     */
    public synchronized boolean unschedule(String jobId)
    {
        boolean cancelled = cancel(jobId);
        if (cancelled) {
            logger.info("Unscheduled backup of {}", jobId);
        }
        return cancelled;
    }

    public synchronized Optional<Instant> getNextRunTime(String jobId)
    {
        Timer timer = timers.get(jobId);
        if (timer == null || timer.rearmOnly) {
            return Optional.absent();
        }
        return Optional.of(timer.time);
    }

    public synchronized List<ScheduledFiring> getScheduledFirings()
    {
        List<ScheduledFiring> firings = new ArrayList<>();
        for (Timer timer : timers.values()) {
            if (!timer.rearmOnly) {
                firings.add(ScheduledFiring.of(timer.jobId, timer.time));
            }
        }
        firings.sort((a, b) -> a.getNextRunTime().compareTo(b.getNextRunTime()));
        return firings;
    }

    /**
     * Returns the time {@link #schedule(Job)} would arm the job for if it
     * were called now.
     */
    public Instant computeFiringTime(JobDefinition job)
    {
        return computeFiringTime(job, clock.instant());
    }

    @VisibleForTesting
    Instant computeFiringTime(JobDefinition job, Instant now)
    {
        Instant next = calculator.computeNextRun(job, now);
        if (Duration.between(now, next).compareTo(GUARD_BAND) < 0) {
            next = calculator.advance(job, next);
        }
        if (Duration.between(now, next).compareTo(MINIMUM_DELAY) < 0) {
            next = now.plus(MINIMUM_DELAY);
        }
        return next;
    }

    private boolean cancel(String jobId)
    {
        Timer timer = timers.remove(jobId);
        if (timer == null) {
            return false;
        }
        timer.future.cancel(false);
        return true;
    }

    private boolean arm(Timer timer, Duration delay)
    {
        try {
            timer.future = timerExecutor.schedule(() -> onTimer(timer), delay.toMillis(), MILLISECONDS);
        }
        catch (RejectedExecutionException ex) {
            logger.error("Failed to arm timer of {}", timer.jobId, ex);
            return false;
        }
        timers.put(timer.jobId, timer);
        return true;
    }

    private void onTimer(Timer timer)
    {
        synchronized (this) {
            if (timers.get(timer.jobId) != timer) {
                // cancelled or replaced after the timer thread picked it up
                return;
            }
            timers.remove(timer.jobId);
            if (timer.rearmOnly) {
                rearm(timer.jobId);
                return;
            }
            try {
                workers.submit(() -> runFiring(timer.jobId));
            }
            catch (RejectedExecutionException ex) {
                logger.error("Failed to submit backup of {}", timer.jobId, ex);
                retryRearm(timer.jobId);
            }
        }
    }

    @VisibleForTesting
    void runFiring(String jobId)
    {
        logger.info("Firing backup of {}", jobId);
        try {
            Optional<Job> fired = handler.fire(jobId);
            if (!fired.isPresent()) {
                return;
            }
        }
        catch (Throwable t) {
            logger.error("An uncaught exception is ignored. Backup of {} will be re-armed.", jobId, t);
        }
        rearm(jobId);
    }

    private synchronized void rearm(String jobId)
    {
        try {
            Optional<Job> latest = jobStore.getJobById(jobId);
            if (!latest.isPresent()) {
                logger.info("Job {} was deleted while its backup was running. It is not re-armed", jobId);
                return;
            }
            schedule(latest.get());
        }
        catch (RuntimeException ex) {
            logger.error("Failed to re-arm backup of {}. Retrying in {}", jobId, REARM_RETRY_INTERVAL, ex);
            retryRearm(jobId);
        }
    }

    private void retryRearm(String jobId)
    {
        if (timerExecutor == null) {
            return;
        }
        cancel(jobId);
        arm(new Timer(jobId, clock.instant().plus(REARM_RETRY_INTERVAL), true), REARM_RETRY_INTERVAL);
    }
}
