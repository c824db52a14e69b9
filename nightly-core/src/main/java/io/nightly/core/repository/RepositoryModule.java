package io.nightly.core.repository;

import java.nio.file.Paths;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Binder;
import com.google.inject.Inject;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import io.nightly.core.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RepositoryModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(JobStore.class).toProvider(JobStoreProvider.class).in(Scopes.SINGLETON);
        binder.bind(JobControl.class).in(Scopes.SINGLETON);
    }

    public static class JobStoreProvider
            implements Provider<JobStore>
    {
        private static final Logger logger = LoggerFactory.getLogger(JobStoreProvider.class);

        private final JobStore store;

        @Inject
        public JobStoreProvider(Config systemConfig, ObjectMapper mapper)
        {
            if (systemConfig.has("jobs.file")) {
                FileJobStore file = new FileJobStore(mapper, Paths.get(systemConfig.get("jobs.file", String.class)));
                logger.debug("Using job file {}", file.getPath());
                this.store = file;
            }
            else {
                logger.debug("jobs.file is not set. Jobs are kept in memory");
                this.store = new MemoryJobStore();
            }
        }

        @Override
        public JobStore get()
        {
            return store;
        }
    }
}
