package io.nightly.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import com.beust.jcommander.Parameter;
import com.google.common.io.ByteStreams;
import io.nightly.core.NightlyEmbed;
import io.nightly.core.archive.BackupFileManager;
import io.nightly.core.repository.ResourceNotFoundException;

import static io.nightly.cli.SystemExitException.systemExit;

public class Download
    extends Command
{
    @Parameter(names = {"-o", "--output"})
    String output = null;

    @Override
    public void main()
        throws Exception
    {
        if (args.size() != 1) {
            throw usage(null);
        }
        download(args.get(0));
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " download <file>");
        err.println("  Options:");
        err.println("    -o, --output PATH                write the file to this path, or - for stdout (default: ./<file>)");
        showCommonOptions();
        return systemExit(error);
    }

    private void download(String fileName)
        throws IOException, SystemExitException
    {
        try (NightlyEmbed embed = buildEmbed()) {
            BackupFileManager manager = embed.getBackupFileManager();
            try (InputStream in = manager.openFile(fileName)) {
                if ("-".equals(output)) {
                    ByteStreams.copy(in, out);
                    out.flush();
                    return;
                }
                Path dest = Paths.get(output != null ? output : fileName);
                long size;
                try (OutputStream os = Files.newOutputStream(dest, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                    size = ByteStreams.copy(in, os);
                }
                catch (FileAlreadyExistsException ex) {
                    throw systemExit("File already exists: " + dest);
                }
                err.println("Downloaded " + fileName + " to " + dest + " (" + TimeUtil.formatSize(size) + ").");
            }
            catch (ResourceNotFoundException | IllegalArgumentException ex) {
                throw systemExit(ex.getMessage());
            }
        }
    }
}
