package io.nightly.core;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import io.nightly.core.archive.BackupFileManager;
import io.nightly.core.config.PropertyUtils;
import io.nightly.core.repository.Cadence;
import io.nightly.core.repository.FileJobStore;
import io.nightly.core.repository.Job;
import io.nightly.core.repository.JobStore;
import io.nightly.core.repository.MemoryJobStore;
import io.nightly.spi.ArchiveProvider;
import io.nightly.spi.DumpProviderFactory;
import io.nightly.spi.MailProvider;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static io.nightly.core.JobFixtures.definition;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.mock;

public class NightlyEmbedTest
{
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private NightlyEmbed embed(Properties props)
    {
        return new NightlyEmbed.Bootstrap()
            .setSystemConfig(PropertyUtils.toConfigElement(props))
            .addModules(binder -> {
                binder.bind(DumpProviderFactory.class).toInstance(mock(DumpProviderFactory.class));
                binder.bind(ArchiveProvider.class).toInstance(mock(ArchiveProvider.class));
                binder.bind(MailProvider.class).toInstance(mock(MailProvider.class));
            })
            .initialize();
    }

    @Test
    public void jobsAreKeptInMemoryByDefault()
    {
        try (NightlyEmbed embed = embed(new Properties())) {
            assertThat(embed.getInjector().getInstance(JobStore.class), instanceOf(MemoryJobStore.class));
            assertThat(embed.getInjector().getInstance(BackupFileManager.class), is(embed.getBackupFileManager()));
        }
    }

    @Test
    public void schedulesStoredJobsOnStart()
    {
        Path jobsFile = folder.getRoot().toPath().resolve("jobs.json");
        Properties props = new Properties();
        props.setProperty("jobs.file", jobsFile.toString());
        props.setProperty("backup.dir", folder.getRoot().toPath().resolve("backups").toString());
        props.setProperty("schedule.reload_interval", "0");

        Job added;
        try (NightlyEmbed cli = embed(props)) {
            assertThat(cli.getInjector().getInstance(JobStore.class), instanceOf(FileJobStore.class));
            added = cli.getJobControl().addJob(definition(Cadence.DAILY, 2, 0).build());
            assertThat(cli.getScheduler().getNextRunTime(added.getId()).isPresent(), is(false));
        }
        assertThat(Files.exists(jobsFile), is(true));

        try (NightlyEmbed server = embed(props)) {
            server.startScheduler();
            assertThat(server.getScheduler().isStarted(), is(true));
            assertThat(server.getScheduler().getNextRunTime(added.getId()).isPresent(), is(true));
        }
    }

    @Test
    public void disabledSchedulerStaysIdle()
    {
        Properties props = new Properties();
        props.setProperty("schedule.enabled", "false");
        try (NightlyEmbed embed = embed(props)) {
            embed.getJobControl().addJob(definition(Cadence.DAILY, 2, 0).build());
            embed.startScheduler();
            assertThat(embed.getScheduler().isStarted(), is(false));
            assertThat(embed.getScheduler().getScheduledFirings().isEmpty(), is(true));
        }
    }
}
