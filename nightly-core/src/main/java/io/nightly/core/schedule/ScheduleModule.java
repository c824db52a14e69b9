package io.nightly.core.schedule;

import com.google.inject.Module;
import com.google.inject.Binder;
import com.google.inject.Scopes;

public class ScheduleModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ScheduleConfig.class).toProvider(ScheduleConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(ExecutionLock.class).to(MemoryExecutionLock.class).in(Scopes.SINGLETON);
        binder.bind(NextRunCalculator.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleHandler.class).in(Scopes.SINGLETON);
        binder.bind(BackupScheduler.class).in(Scopes.SINGLETON);
        binder.bind(JobReloader.class).in(Scopes.SINGLETON);
    }
}
