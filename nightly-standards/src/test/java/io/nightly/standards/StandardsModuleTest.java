package io.nightly.standards;

import java.util.Properties;
import io.nightly.core.NightlyEmbed;
import io.nightly.core.backup.BackupExecutor;
import io.nightly.core.config.PropertyUtils;
import io.nightly.spi.ArchiveProvider;
import io.nightly.spi.DumpProviderFactory;
import io.nightly.spi.MailProvider;
import io.nightly.standards.archive.CompressArchiveProvider;
import io.nightly.standards.dump.JdbcDumpProviderFactory;
import io.nightly.standards.mail.SmtpMailProvider;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.notNullValue;

public class StandardsModuleTest
{
    @Test
    public void bindsDefaultCollaborators()
    {
        Properties props = new Properties();
        props.setProperty("database.url", "jdbc:h2:mem:standards");
        try (NightlyEmbed embed = new NightlyEmbed.Bootstrap()
                .setSystemConfig(PropertyUtils.toConfigElement(props))
                .addModules(new StandardsModule())
                .initialize()) {
            assertThat(embed.getInjector().getInstance(DumpProviderFactory.class), instanceOf(JdbcDumpProviderFactory.class));
            assertThat(embed.getInjector().getInstance(ArchiveProvider.class), instanceOf(CompressArchiveProvider.class));
            assertThat(embed.getInjector().getInstance(MailProvider.class), instanceOf(SmtpMailProvider.class));
            assertThat(embed.getInjector().getInstance(BackupExecutor.class), notNullValue());
        }
    }
}
