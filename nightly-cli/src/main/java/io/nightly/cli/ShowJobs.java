package io.nightly.cli;

import java.time.Clock;
import java.util.List;
import io.nightly.core.NightlyEmbed;
import io.nightly.core.repository.Job;
import io.nightly.core.schedule.NextRunCalculator;

import static io.nightly.cli.SystemExitException.systemExit;

public class ShowJobs
    extends Command
{
    @Override
    public void main()
        throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }
        try (NightlyEmbed embed = buildEmbed()) {
            List<Job> jobs = embed.getJobControl().getJobs();
            if (jobs.isEmpty()) {
                ln("No jobs.");
                return;
            }

            Clock clock = embed.getInjector().getInstance(Clock.class);
            NextRunCalculator calculator = embed.getInjector().getInstance(NextRunCalculator.class);

            TablePrinter table = new TablePrinter(out);
            table.row("ID", "TITLE", "CADENCE", "SCHEDULE", "STORAGE", "FORMAT", "NEXT RUN");
            for (Job job : jobs) {
                table.row(
                        job.getId(),
                        job.getTitle(),
                        job.getCadence().getName(),
                        JobCommand.describeSchedule(job),
                        job.getStorage().getName() + job.getEmail().transform(email -> " (" + email + ")").or(""),
                        job.getFormat().getName(),
                        TimeUtil.formatTime(calculator.computeNextRun(job, clock.instant()), clock.getZone()));
            }
            table.print();
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " jobs");
        err.println("  Options:");
        showCommonOptions();
        return systemExit(error);
    }
}
