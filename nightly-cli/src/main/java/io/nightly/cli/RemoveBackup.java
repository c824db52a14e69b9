package io.nightly.cli;

import io.nightly.core.NightlyEmbed;
import io.nightly.core.repository.ResourceNotFoundException;

import static io.nightly.cli.SystemExitException.systemExit;

public class RemoveBackup
    extends Command
{
    @Override
    public void main()
        throws Exception
    {
        if (args.size() != 1) {
            throw usage(null);
        }
        String fileName = args.get(0);
        try (NightlyEmbed embed = buildEmbed()) {
            try {
                embed.getBackupFileManager().deleteFile(fileName);
            }
            catch (ResourceNotFoundException | IllegalArgumentException ex) {
                throw systemExit(ex.getMessage());
            }
        }
        ln("Removed %s.", fileName);
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " remove <file>");
        err.println("  Options:");
        showCommonOptions();
        return systemExit(error);
    }
}
