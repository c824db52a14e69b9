package io.nightly.cli;

import java.io.PrintStream;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Strings;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import org.slf4j.LoggerFactory;

import static io.nightly.cli.ConfigUtil.defaultConfigPath;
import static io.nightly.cli.NightlyVersion.buildVersion;
import static io.nightly.cli.SystemExitException.systemExit;
import static java.util.Locale.ENGLISH;

public class Main
{
    private static final String DEFAULT_PROGRAM_NAME = "nightly";

    private final String version;
    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final String programName;

    public Main(String version, Map<String, String> env, PrintStream out, PrintStream err)
    {
        this.version = version;
        this.env = env;
        this.out = out;
        this.err = err;
        this.programName = System.getProperty("io.nightly.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    public static class MainOptions
    {
        @Parameter(names = {"-c", "--config"})
        protected String configPath = null;

        @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
        boolean help;
    }

    public static void main(String... args)
    {
        int code = new Main(buildVersion(), System.getenv(), System.out, System.err).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    protected void addCommands(final JCommander jc, final Injector injector)
    {
        jc.addCommand("server", injector.getInstance(Server.class));

        jc.addCommand("jobs", injector.getInstance(ShowJobs.class), "job");
        jc.addCommand("add", injector.getInstance(AddJob.class));
        jc.addCommand("edit", injector.getInstance(EditJob.class));
        jc.addCommand("delete", injector.getInstance(DeleteJob.class));

        jc.addCommand("backups", injector.getInstance(ShowBackups.class), "backup");
        jc.addCommand("download", injector.getInstance(Download.class));
        jc.addCommand("remove", injector.getInstance(RemoveBackup.class));

        jc.addCommand("version", injector.getInstance(Version.class));
    }

    public int cli(String... args)
    {
        for (String arg : args) {
            if ("--version".equals(arg)) {
                out.println(version);
                return 0;
            }
        }
        err.println(DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss Z", ENGLISH).format(ZonedDateTime.now()) + ": Nightly v" + version);
        if (args.length == 0) {
            usage(null);
            return 0;
        }

        boolean verbose = false;

        MainOptions mainOpts = new MainOptions();
        JCommander jc = new JCommander(mainOpts);
        jc.setProgramName(programName);

        Injector injector = Guice.createInjector(new AbstractModule()
        {
            @Override
            protected void configure()
            {
                bind(new TypeLiteral<Map<String, String>>() {}).annotatedWith(Environment.class).toInstance(env);
                bind(String.class).annotatedWith(BuildVersion.class).toInstance(version);
                bind(String.class).annotatedWith(ProgramName.class).toInstance(programName);
                bind(PrintStream.class).annotatedWith(StdOut.class).toInstance(out);
                bind(PrintStream.class).annotatedWith(StdErr.class).toInstance(err);
            }
        });

        addCommands(jc, injector);

        // Disable @ expansion
        jc.setExpandAtSign(false);
        jc.getCommands().values().forEach(c -> c.setExpandAtSign(false));

        try {
            try {
                jc.parse(args);
            }
            catch (MissingCommandException ex) {
                throw usage("available commands are: " + jc.getCommands().keySet());
            }

            if (mainOpts.help) {
                throw usage(null);
            }

            Command command = getParsedCommand(jc);
            if (command == null) {
                throw usage(null);
            }

            verbose = processCommonOptions(mainOpts, command);

            command.main();
            return 0;
        }
        catch (ParameterException ex) {
            err.println("error: " + ex.getMessage());
            return 1;
        }
        catch (SystemExitException ex) {
            if (ex.getMessage() != null) {
                err.println("error: " + ex.getMessage());
            }
            return ex.getCode();
        }
        catch (Exception ex) {
            String message = formatExceptionMessage(ex);
            if (message.trim().isEmpty()) {
                // prevent silent crash
                ex.printStackTrace(err);
            }
            else {
                err.println("error: " + message);
                if (verbose) {
                    ex.printStackTrace(err);
                }
            }
            return 1;
        }
    }

    private static Command getParsedCommand(JCommander jc)
    {
        String commandName = jc.getParsedCommand();
        if (commandName == null) {
            return null;
        }

        return (Command) jc.getCommands().get(commandName).getObjects().get(0);
    }

    private boolean processCommonOptions(MainOptions mainOpts, Command command)
            throws SystemExitException
    {
        if (command.help) {
            throw command.usage(null);
        }

        boolean verbose;

        switch (command.logLevel) {
        case "error":
        case "warn":
        case "info":
            verbose = false;
            break;
        case "debug":
        case "trace":
            verbose = true;
            break;
        default:
            throw usage("Unknown log level '" + command.logLevel + "'");
        }

        if (command.configPath == null) {
            command.configPath = mainOpts.configPath;
        }

        configureLogging(command.logLevel, command.logPath);

        for (Map.Entry<String, String> pair : command.systemProperties.entrySet()) {
            System.setProperty(pair.getKey(), pair.getValue());
        }

        return verbose;
    }

    private static void configureLogging(String level, String logPath)
    {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();

        // logback uses system property to embed variables in XML file
        Level lv = Level.toLevel(level.toUpperCase(ENGLISH), Level.DEBUG);
        System.setProperty("nightly.log.level", lv.toString());

        String name;
        if (logPath.equals("-")) {
            name = "/io/nightly/cli/logback-console.xml";
        }
        else {
            System.setProperty("nightly.log.path", logPath);
            name = "/io/nightly/cli/logback-file.xml";
        }
        try {
            configurator.doConfigure(Main.class.getResource(name));
        }
        catch (JoranException ex) {
            throw new RuntimeException(ex);
        }
    }

    static String formatExceptionMessage(Throwable ex)
    {
        StringBuilder sb = new StringBuilder();
        Throwable t = ex;
        while (t != null) {
            String message = t.getMessage();
            if (Strings.isNullOrEmpty(message)) {
                message = t.getClass().getSimpleName();
            }
            if (sb.indexOf(message) == -1) {
                if (sb.length() > 0) {
                    sb.append("\n> ");
                }
                sb.append(message);
            }
            t = t.getCause();
        }
        return sb.toString();
    }

    private SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " <command> [options...]");
        err.println("  Server-mode commands:");
        err.println("    server                             run the backup scheduler until killed");
        err.println("");
        err.println("  Job commands:");
        err.println("    jobs                               show jobs and their next run time");
        err.println("    add --title T --cadence C --time HH:MM [options...]");
        err.println("                                       create a new backup job");
        err.println("    edit <job-id> [options...]         change a backup job");
        err.println("    delete <job-id>                    delete a backup job");
        err.println("");
        err.println("  Backup file commands:");
        err.println("    backups                            show backup files on this server");
        err.println("    download <file>                    copy a backup file");
        err.println("    remove <file>                      delete a backup file");
        err.println("    version                            show version");
        err.println("");
        err.println("  Options:");
        showCommonOptions(env, err);
        if (error == null) {
            err.println("Use `<command> --help` to see detailed usage of a command.");
            return systemExit(null);
        }
        else {
            return systemExit(error);
        }
    }

    public static void showCommonOptions(Map<String, String> env, PrintStream err)
    {
        err.println("    -L, --log PATH                   output log messages to a file (default: -)");
        err.println("    -l, --log-level LEVEL            log level (error, warn, info, debug or trace)");
        err.println("    -X KEY=VALUE                     add a system config");
        err.println("    -c, --config PATH.properties     Configuration file (default: " + defaultConfigPath(env) + ")");
        err.println("    --version                        show client version");
        err.println("");
    }
}
