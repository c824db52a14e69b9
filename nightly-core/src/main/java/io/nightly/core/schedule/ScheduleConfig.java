package io.nightly.core.schedule;

import io.nightly.core.config.Config;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

@Value.Immutable
@JsonSerialize(as = ImmutableScheduleConfig.class)
@JsonDeserialize(as = ImmutableScheduleConfig.class)
public interface ScheduleConfig
{
    boolean getEnabled();

    /**
     * Number of threads that run backups. Timers never wait for a backup.
     */
    int getMaxWorkers();

    /**
     * Seconds between two polls of the job store by the reloader. 0 disables reloading.
     */
    int getReloadInterval();

    @Value.Check
    default void check()
    {
        checkState(getMaxWorkers() > 0, "schedule.max_workers must be positive");
        checkState(getReloadInterval() >= 0, "schedule.reload_interval must not be negative");
    }

    static ImmutableScheduleConfig.Builder defaultBuilder()
    {
        return ImmutableScheduleConfig.builder()
            .enabled(true)
            .maxWorkers(2)
            .reloadInterval(5);
    }

    static ScheduleConfig convertFrom(Config config)
    {
        return defaultBuilder()
            .enabled(config.get("schedule.enabled", boolean.class, true))
            .maxWorkers(config.get("schedule.max_workers", int.class, 2))
            .reloadInterval(config.get("schedule.reload_interval", int.class, 5))
            .build();
    }
}
