package io.nightly.core.repository;

import java.util.List;
import com.google.common.base.Optional;

/**
 * Ordered, durable list of backup jobs.
 *
 * Implementations must be safe to call from the admin path and from
 * scheduler worker threads at the same time. Concurrent writes to the
 * same job are resolved by the last writer.
 */
public interface JobStore
{
    List<Job> getJobs();

    Optional<Job> getJobById(String id);

    /**
     * Replaces the job with the same id keeping its position, or appends
     * it if no such job exists.
     */
    void putJob(Job job);

    /**
     * Returns false if no job has the id.
     */
    boolean deleteJob(String id);
}
