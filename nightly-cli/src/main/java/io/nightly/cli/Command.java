package io.nightly.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.google.inject.Inject;
import io.nightly.core.NightlyEmbed;
import io.nightly.core.config.PropertyUtils;
import io.nightly.standards.StandardsModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.nightly.cli.SystemExitException.systemExit;

public abstract class Command
{
    private static final Logger logger = LoggerFactory.getLogger(Command.class);

    @Inject @Environment protected Map<String, String> env;
    @Inject @BuildVersion protected String version;
    @Inject @ProgramName protected String programName;
    @Inject @StdOut protected PrintStream out;
    @Inject @StdErr protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected String configPath = null;

    @Parameter(names = {"-L", "--log"})
    protected String logPath = "-";

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "info";

    @DynamicParameter(names = "-X")
    protected Map<String, String> systemProperties = new HashMap<>();

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    public abstract SystemExitException usage(String error);

    protected Properties loadSystemProperties()
        throws IOException, SystemExitException
    {
        // Property order of precedence:
        // 1. Explicit configuration file (if --config was specified)
        // 2. JVM System properties (-D... and -X KEY=VALUE)
        // 3. NIGHTLY_CONFIG env var
        // 4. Default config file (unless --config was specified)

        Properties props = new Properties();

        if (configPath == null) {
            Path defaultConfigPath = ConfigUtil.defaultConfigPath(env);
            try {
                props.putAll(PropertyUtils.loadFile(defaultConfigPath));
            }
            catch (NoSuchFileException ex) {
                logger.trace("configuration file not found: {}", defaultConfigPath, ex);
            }
        }

        props.load(new StringReader(env.getOrDefault("NIGHTLY_CONFIG", "")));

        props.putAll(System.getProperties());

        if (configPath != null) {
            try {
                props.putAll(PropertyUtils.loadFile(Paths.get(configPath)));
            }
            catch (NoSuchFileException ex) {
                throw systemExit("configuration file not found: " + configPath);
            }
        }

        if (!props.containsKey("jobs.file")) {
            props.setProperty("jobs.file", ConfigUtil.defaultJobsPath(env).toString());
        }

        return props;
    }

    protected NightlyEmbed buildEmbed()
        throws IOException, SystemExitException
    {
        Properties props = loadSystemProperties();
        return new NightlyEmbed.Bootstrap()
            .setSystemConfig(PropertyUtils.toConfigElement(props))
            .addModules(new StandardsModule())
            .initialize();
    }

    protected void showCommonOptions()
    {
        Main.showCommonOptions(env, err);
    }

    protected void ln(String format, Object... args)
    {
        out.println(String.format(format, args));
    }
}
