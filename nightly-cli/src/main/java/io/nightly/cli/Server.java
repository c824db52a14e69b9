package io.nightly.cli;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import io.nightly.core.NightlyEmbed;
import io.nightly.core.schedule.ScheduledFiring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.nightly.cli.SystemExitException.systemExit;

public class Server
    extends Command
{
    private static final Logger logger = LoggerFactory.getLogger(Server.class);

    @Override
    public void main()
        throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }

        NightlyEmbed embed = buildEmbed();
        embed.startScheduler();
        if (!embed.getScheduler().isStarted()) {
            embed.close();
            throw systemExit("scheduler is disabled (schedule.enabled=false)");
        }

        Clock clock = embed.getInjector().getInstance(Clock.class);
        for (ScheduledFiring firing : embed.getScheduler().getScheduledFirings()) {
            ln("  %s: next run at %s", firing.getJobId(), TimeUtil.formatTime(firing.getNextRunTime(), clock.getZone()));
        }
        logger.info("Backup scheduler started in {}", clock.getZone());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down backup scheduler");
            try {
                embed.close();
            }
            finally {
                stopped.countDown();
            }
        }, "shutdown"));
        stopped.await();
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " server [options...]");
        err.println("  Runs scheduled backups until the process is stopped.");
        err.println("  The job file is re-read every schedule.reload_interval seconds.");
        err.println("  Options:");
        showCommonOptions();
        return systemExit(error);
    }
}
