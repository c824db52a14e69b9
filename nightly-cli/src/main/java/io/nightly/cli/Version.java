package io.nightly.cli;

import static io.nightly.cli.SystemExitException.systemExit;

public class Version
    extends Command
{
    @Override
    public void main()
        throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }
        ln("Version: %s", version);
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " version");
        err.println("  Options:");
        showCommonOptions();
        return systemExit(error);
    }
}
