package io.nightly.core.repository;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import static java.util.Locale.ENGLISH;

public enum Cadence
{
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String name;

    private Cadence(String name)
    {
        this.name = name;
    }

    @JsonCreator
    public static Cadence of(String name)
    {
        switch (name.trim().toLowerCase(ENGLISH)) {
        case "daily":
            return DAILY;
        case "weekly":
            return WEEKLY;
        case "monthly":
            return MONTHLY;
        default:
            throw new IllegalArgumentException("Unknown cadence: " + name);
        }
    }

    @JsonValue
    public String getName()
    {
        return name;
    }

    @Override
    public String toString()
    {
        return name;
    }
}
