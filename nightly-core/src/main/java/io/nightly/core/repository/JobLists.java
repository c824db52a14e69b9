package io.nightly.core.repository;

import java.util.Iterator;
import java.util.List;
import com.google.common.base.Optional;

class JobLists
{
    private JobLists()
    { }

    static Optional<Job> find(List<Job> jobs, String id)
    {
        for (Job job : jobs) {
            if (job.getId().equals(id)) {
                return Optional.of(job);
            }
        }
        return Optional.absent();
    }

    static void put(List<Job> jobs, Job job)
    {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).getId().equals(job.getId())) {
                jobs.set(i, job);
                return;
            }
        }
        jobs.add(job);
    }

    static boolean remove(List<Job> jobs, String id)
    {
        Iterator<Job> ite = jobs.iterator();
        while (ite.hasNext()) {
            if (ite.next().getId().equals(id)) {
                ite.remove();
                return true;
            }
        }
        return false;
    }
}
