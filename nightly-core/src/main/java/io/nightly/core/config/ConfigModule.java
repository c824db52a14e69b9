package io.nightly.core.config;

import java.time.Clock;
import com.google.inject.Inject;
import com.google.inject.Module;
import com.google.inject.Binder;
import com.google.inject.Provider;
import com.google.inject.Scopes;

public class ConfigModule
        implements Module
{
    private final ConfigElement systemConfig;

    public ConfigModule(ConfigElement systemConfig)
    {
        this.systemConfig = systemConfig;
    }

    @Override
    public void configure(Binder binder)
    {
        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
        binder.bind(ConfigElement.class).toInstance(systemConfig);
        binder.bind(Config.class).toProvider(SystemConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(Clock.class).toProvider(ClockProvider.class).in(Scopes.SINGLETON);
    }

    public static class SystemConfigProvider
            implements Provider<Config>
    {
        private final Config systemConfig;

        @Inject
        public SystemConfigProvider(ConfigElement ce, ConfigFactory cf)
        {
            this.systemConfig = ce.toConfig(cf);
        }

        @Override
        public Config get()
        {
            return systemConfig;
        }
    }
}
