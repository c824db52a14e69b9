package io.nightly.standards;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.nightly.spi.ArchiveProvider;
import io.nightly.spi.DumpProviderFactory;
import io.nightly.spi.MailProvider;
import io.nightly.standards.archive.CompressArchiveProvider;
import io.nightly.standards.dump.JdbcDumpProviderFactory;
import io.nightly.standards.mail.SmtpMailProvider;

public class StandardsModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DumpProviderFactory.class).to(JdbcDumpProviderFactory.class).in(Scopes.SINGLETON);
        binder.bind(ArchiveProvider.class).to(CompressArchiveProvider.class).in(Scopes.SINGLETON);
        binder.bind(MailProvider.class).to(SmtpMailProvider.class).in(Scopes.SINGLETON);
    }
}
