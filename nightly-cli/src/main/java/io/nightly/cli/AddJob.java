package io.nightly.cli;

import java.time.Clock;
import java.time.Instant;
import io.nightly.core.NightlyEmbed;
import io.nightly.core.repository.Job;
import io.nightly.core.repository.JobDefinition;
import io.nightly.core.repository.ModelValidationException;

import static io.nightly.cli.SystemExitException.systemExit;

public class AddJob
    extends JobCommand
{
    @Override
    public void main()
        throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }
        if (title == null || cadence == null || time == null) {
            throw usage("--title, --cadence and --time options are required");
        }

        try (NightlyEmbed embed = buildEmbed()) {
            JobDefinition def = applyOptions(JobDefinition.definitionBuilder()).build();
            Job job;
            try {
                job = embed.getJobControl().addJob(def);
            }
            catch (ModelValidationException ex) {
                throw systemExit(ex.getMessage());
            }
            Instant nextRun = embed.getScheduler().computeFiringTime(job);
            Clock clock = embed.getInjector().getInstance(Clock.class);
            ln("Added job %s.", job.getId());
            showJob(job, nextRun, clock.getZone());
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " add --title TEXT --cadence CADENCE --time HH:MM [options...]");
        err.println("  Options:");
        showJobOptions();
        showCommonOptions();
        return systemExit(error);
    }
}
