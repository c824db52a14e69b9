package io.nightly.cli;

import java.io.IOException;
import java.net.URL;
import com.google.common.io.Resources;

import static java.nio.charset.StandardCharsets.UTF_8;

public class NightlyVersion
{
    public static final String VERSION_PROPERTY = "io.nightly.cli.version";

    private NightlyVersion()
    { }

    public static String buildVersion()
    {
        // First read version from system property
        String propertyVersion = System.getProperty(VERSION_PROPERTY);
        if (propertyVersion != null) {
            return propertyVersion;
        }

        // Then read version file
        URL resource = NightlyVersion.class.getResource("version.txt");
        if (resource == null) {
            return "unknown";
        }
        try {
            return Resources.toString(resource, UTF_8).trim();
        }
        catch (IOException ex) {
            throw new IllegalStateException("Failed to read version.txt", ex);
        }
    }
}
