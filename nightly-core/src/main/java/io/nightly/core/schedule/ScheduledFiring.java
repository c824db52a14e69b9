package io.nightly.core.schedule;

import java.time.Instant;
import org.immutables.value.Value;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

@Value.Immutable
@JsonSerialize(as = ImmutableScheduledFiring.class)
@JsonDeserialize(as = ImmutableScheduledFiring.class)
public abstract class ScheduledFiring
{
    public abstract String getJobId();

    public abstract Instant getNextRunTime();

    public static ScheduledFiring of(String jobId, Instant nextRunTime)
    {
        return ImmutableScheduledFiring.builder()
            .jobId(jobId)
            .nextRunTime(nextRunTime)
            .build();
    }
}
