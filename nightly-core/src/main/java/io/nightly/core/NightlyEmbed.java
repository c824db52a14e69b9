package io.nightly.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Stage;
import com.google.inject.util.Modules;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.guice.ObjectMapperModule;
import io.nightly.core.archive.BackupFileManager;
import io.nightly.core.backup.BackupModule;
import io.nightly.core.config.ConfigElement;
import io.nightly.core.config.ConfigModule;
import io.nightly.core.repository.JobControl;
import io.nightly.core.repository.RepositoryModule;
import io.nightly.core.schedule.BackupScheduler;
import io.nightly.core.schedule.JobReloader;
import io.nightly.core.schedule.ScheduleModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NightlyEmbed
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(NightlyEmbed.class);

    public static class Bootstrap
    {
        private final List<Function<? super List<Module>, ? extends Iterable<? extends Module>>> moduleOverrides = new ArrayList<>();
        private ConfigElement systemConfig = ConfigElement.empty();

        public Bootstrap addModules(Module... additionalModules)
        {
            return addModules(Arrays.asList(additionalModules));
        }

        public Bootstrap addModules(Iterable<? extends Module> additionalModules)
        {
            final List<Module> copy = ImmutableList.copyOf(additionalModules);
            return overrideModules(modules -> Iterables.concat(modules, copy));
        }

        public Bootstrap overrideModules(Function<? super List<Module>, ? extends Iterable<? extends Module>> function)
        {
            moduleOverrides.add(function);
            return this;
        }

        public Bootstrap overrideModulesWith(Module... overridingModules)
        {
            final List<Module> copy = ImmutableList.copyOf(overridingModules);
            return overrideModules(modules -> ImmutableList.of(Modules.override(modules).with(copy)));
        }

        public Bootstrap setSystemConfig(ConfigElement systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        public NightlyEmbed initialize()
        {
            List<Module> modules = standardModules(systemConfig);
            for (Function<? super List<Module>, ? extends Iterable<? extends Module>> override : moduleOverrides) {
                modules = ImmutableList.copyOf(override.apply(modules));
            }
            Injector injector = Guice.createInjector(Stage.PRODUCTION, modules);
            return new NightlyEmbed(injector);
        }

        private static List<Module> standardModules(ConfigElement systemConfig)
        {
            return ImmutableList.<Module>of(
                    new ObjectMapperModule()
                        .registerModule(new GuavaModule())
                        .registerModule(new JavaTimeModule()),
                    new ConfigModule(systemConfig),
                    new RepositoryModule(),
                    new ScheduleModule(),
                    new BackupModule(),
                    (binder) -> {
                        binder.requireExplicitBindings();
                    }
                );
        }
    }

    private final Injector injector;

    NightlyEmbed(Injector injector)
    {
        this.injector = injector;
    }

    public Injector getInjector()
    {
        return injector;
    }

    public JobControl getJobControl()
    {
        return injector.getInstance(JobControl.class);
    }

    public BackupScheduler getScheduler()
    {
        return injector.getInstance(BackupScheduler.class);
    }

    public BackupFileManager getBackupFileManager()
    {
        return injector.getInstance(BackupFileManager.class);
    }

    /**
     * Arms every stored job and starts watching the job store for changes
     * made by other processes.
     */
    public void startScheduler()
    {
        getScheduler().start();
        if (getScheduler().isStarted()) {
            injector.getInstance(JobReloader.class).start();
        }
    }

    @Override
    public void close()
    {
        logger.debug("Shutting down scheduler");
        injector.getInstance(JobReloader.class).shutdown();
        getScheduler().shutdown();
    }
}
