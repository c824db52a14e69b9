package io.nightly.cli;

import java.time.Clock;
import java.time.Instant;
import io.nightly.core.NightlyEmbed;
import io.nightly.core.repository.Job;
import io.nightly.core.repository.JobControl;
import io.nightly.core.repository.JobDefinition;
import io.nightly.core.repository.ModelValidationException;
import io.nightly.core.repository.ResourceNotFoundException;

import static io.nightly.cli.SystemExitException.systemExit;

public class EditJob
    extends JobCommand
{
    @Override
    public void main()
        throws Exception
    {
        if (args.size() != 1) {
            throw usage(null);
        }
        String id = args.get(0);

        try (NightlyEmbed embed = buildEmbed()) {
            JobControl control = embed.getJobControl();
            Job job;
            try {
                Job existing = control.getJob(id);
                JobDefinition def = applyOptions(JobDefinition.definitionBuilder().from(existing.toDefinition())).build();
                job = control.updateJob(id, def);
            }
            catch (ResourceNotFoundException | ModelValidationException ex) {
                throw systemExit(ex.getMessage());
            }
            Instant nextRun = embed.getScheduler().computeFiringTime(job);
            Clock clock = embed.getInjector().getInstance(Clock.class);
            ln("Updated job %s.", job.getId());
            showJob(job, nextRun, clock.getZone());
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " edit <job-id> [options...]");
        err.println("  Options:");
        showJobOptions();
        err.println("    An empty --email \"\" removes the address.");
        showCommonOptions();
        return systemExit(error);
    }
}
