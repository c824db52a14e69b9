package io.nightly.core.config;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import com.google.inject.Inject;
import com.google.inject.Provider;

/**
 * System clock in the zone set by {@code timezone} (UTC by default). Run
 * times and archive timestamps are local times of this zone.
 */
public class ClockProvider
        implements Provider<Clock>
{
    private final Clock clock;

    @Inject
    public ClockProvider(Config systemConfig)
    {
        String zone = systemConfig.get("timezone", String.class, "UTC");
        try {
            this.clock = Clock.system(ZoneId.of(zone));
        }
        catch (DateTimeException ex) {
            throw new ConfigException("Invalid timezone: " + zone, ex);
        }
    }

    @Override
    public Clock get()
    {
        return clock;
    }
}
