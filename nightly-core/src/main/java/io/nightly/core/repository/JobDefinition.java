package io.nightly.core.repository;

import java.time.DayOfWeek;
import java.time.LocalTime;
import org.immutables.value.Value;
import com.google.common.base.Optional;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.nightly.spi.ArchiveFormat;

@Value.Immutable
@JsonSerialize(as = ImmutableJobDefinition.class)
@JsonDeserialize(as = ImmutableJobDefinition.class)
public abstract class JobDefinition
{
    public abstract String getTitle();

    public abstract Cadence getCadence();

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    public abstract LocalTime getTime();

    /**
     * Target weekday. Meaningful only when cadence is weekly.
     */
    public abstract Optional<DayOfWeek> getWeekday();

    /**
     * Target day of month, 1 to 31. Meaningful only when cadence is monthly.
     * Months shorter than this day run on their last day.
     */
    public abstract Optional<Integer> getDayOfMonth();

    @Value.Default
    public StorageMode getStorage()
    {
        return StorageMode.SERVER;
    }

    @Value.Default
    public ArchiveFormat getFormat()
    {
        return ArchiveFormat.ZIP;
    }

    /**
     * Recipient address. Required when storage is email.
     */
    public abstract Optional<String> getEmail();

    public static ImmutableJobDefinition.Builder definitionBuilder()
    {
        return ImmutableJobDefinition.builder();
    }
}
