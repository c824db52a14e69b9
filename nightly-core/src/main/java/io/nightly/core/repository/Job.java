package io.nightly.core.repository;

import org.immutables.value.Value;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

@Value.Immutable
@JsonSerialize(as = ImmutableJob.class)
@JsonDeserialize(as = ImmutableJob.class)
public abstract class Job
        extends JobDefinition
{
    public abstract String getId();

    public static Job of(String id, JobDefinition def)
    {
        return ImmutableJob.builder()
            .id(id)
            .title(def.getTitle())
            .cadence(def.getCadence())
            .time(def.getTime())
            .weekday(def.getWeekday())
            .dayOfMonth(def.getDayOfMonth())
            .storage(def.getStorage())
            .format(def.getFormat())
            .email(def.getEmail())
            .build();
    }

    public JobDefinition toDefinition()
    {
        return JobDefinition.definitionBuilder()
            .title(getTitle())
            .cadence(getCadence())
            .time(getTime())
            .weekday(getWeekday())
            .dayOfMonth(getDayOfMonth())
            .storage(getStorage())
            .format(getFormat())
            .email(getEmail())
            .build();
    }
}
