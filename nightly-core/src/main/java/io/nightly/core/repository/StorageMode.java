package io.nightly.core.repository;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import static java.util.Locale.ENGLISH;

public enum StorageMode
{
    /**
     * Keep artifacts in the backup directory and prune them by retention.
     */
    SERVER("server"),

    /**
     * Send the artifact to the job's address as an attachment.
     */
    EMAIL("email");

    private final String name;

    private StorageMode(String name)
    {
        this.name = name;
    }

    @JsonCreator
    public static StorageMode of(String name)
    {
        switch (name.trim().toLowerCase(ENGLISH)) {
        case "server":
            return SERVER;
        case "email":
            return EMAIL;
        default:
            throw new IllegalArgumentException("Unknown storage mode: " + name);
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
