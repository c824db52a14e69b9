package io.nightly.cli;

import io.nightly.core.NightlyEmbed;
import io.nightly.core.repository.Job;
import io.nightly.core.repository.ResourceNotFoundException;

import static io.nightly.cli.SystemExitException.systemExit;

public class DeleteJob
    extends Command
{
    @Override
    public void main()
        throws Exception
    {
        if (args.size() != 1) {
            throw usage(null);
        }
        try (NightlyEmbed embed = buildEmbed()) {
            Job job;
            try {
                job = embed.getJobControl().deleteJob(args.get(0));
            }
            catch (ResourceNotFoundException ex) {
                throw systemExit(ex.getMessage());
            }
            ln("Deleted job %s (%s). Existing backup files are kept.", job.getId(), job.getTitle());
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " delete <job-id>");
        err.println("  Options:");
        showCommonOptions();
        return systemExit(error);
    }
}
