package io.nightly.spi;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import static java.util.Locale.ENGLISH;

public enum ArchiveFormat
{
    ZIP("zip", ".zip"),
    TAR("tar", ".tar"),
    NONE("none", "");

    private final String name;
    private final String extension;

    ArchiveFormat(String name, String extension)
    {
        this.name = name;
        this.extension = extension;
    }

    @JsonValue
    public String getName()
    {
        return name;
    }

    /**
     * Suffix appended to the uncompressed dump file name, or an empty string for NONE.
     */
    public String getExtension()
    {
        return extension;
    }

    @JsonCreator
    public static ArchiveFormat of(String name)
    {
        switch (name.trim().toLowerCase(ENGLISH)) {
        case "zip":
            return ZIP;
        case "tar":
            return TAR;
        case "none":
            return NONE;
        default:
            throw new IllegalArgumentException("Unknown archive format: " + name);
        }
    }

    @Override
    public String toString()
    {
        return name;
    }
}
