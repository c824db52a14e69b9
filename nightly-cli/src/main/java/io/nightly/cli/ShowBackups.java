package io.nightly.cli;

import java.time.format.DateTimeFormatter;
import java.util.List;
import io.nightly.core.NightlyEmbed;
import io.nightly.core.archive.BackupFile;

import static io.nightly.cli.SystemExitException.systemExit;
import static java.util.Locale.ENGLISH;

public class ShowBackups
    extends Command
{
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss", ENGLISH);

    @Override
    public void main()
        throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }
        try (NightlyEmbed embed = buildEmbed()) {
            List<BackupFile> files = embed.getBackupFileManager().listFiles();
            if (files.isEmpty()) {
                ln("No backups found.");
                return;
            }

            TablePrinter table = new TablePrinter(out);
            table.row("FILE", "JOB", "CADENCE", "TIMESTAMP", "STORAGE", "SIZE");
            for (BackupFile file : files) {
                table.row(
                        file.getFileName(),
                        file.getName().getJobId(),
                        file.getName().getCadence().getName(),
                        TIMESTAMP_FORMAT.format(file.getName().getTimestamp()),
                        file.getStorage(),
                        TimeUtil.formatSize(file.getSize()));
            }
            table.print();
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " backups");
        err.println("  Options:");
        showCommonOptions();
        return systemExit(error);
    }
}
