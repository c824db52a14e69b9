package io.nightly.core.backup;

import com.google.inject.Module;
import com.google.inject.Binder;
import com.google.inject.Scopes;
import io.nightly.core.archive.BackupFileManager;
import io.nightly.core.archive.RetentionPruner;

/**
 * Binds the backup pipeline. DumpProviderFactory, ArchiveProvider and
 * MailProvider are bound by a separate module.
 */
public class BackupModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(BackupConfig.class).toProvider(BackupConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(DumpWriter.class).in(Scopes.SINGLETON);
        binder.bind(RetentionPruner.class).in(Scopes.SINGLETON);
        binder.bind(BackupExecutor.class).in(Scopes.SINGLETON);
        binder.bind(BackupFileManager.class).in(Scopes.SINGLETON);
    }
}
