package io.nightly.core.repository;

import java.util.ArrayList;
import java.util.List;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;

public class MemoryJobStore
        implements JobStore
{
    private final List<Job> jobs = new ArrayList<>();

    @Override
    public synchronized List<Job> getJobs()
    {
        return ImmutableList.copyOf(jobs);
    }

    @Override
    public synchronized Optional<Job> getJobById(String id)
    {
        return JobLists.find(jobs, id);
    }

    @Override
    public synchronized void putJob(Job job)
    {
        JobLists.put(jobs, job);
    }

    @Override
    public synchronized boolean deleteJob(String id)
    {
        return JobLists.remove(jobs, id);
    }
}
