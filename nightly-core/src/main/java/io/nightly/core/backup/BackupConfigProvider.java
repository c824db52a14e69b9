package io.nightly.core.backup;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.nightly.core.config.Config;

public class BackupConfigProvider
    implements Provider<BackupConfig>
{
    private final BackupConfig config;

    @Inject
    public BackupConfigProvider(Config systemConfig)
    {
        this.config = BackupConfig.convertFrom(systemConfig);
    }

    @Override
    public BackupConfig get()
    {
        return config;
    }
}
