package io.nightly.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigUtil
{
    private ConfigUtil()
    { }

    public static Path defaultConfigPath(Map<String, String> env)
    {
        return nightlyConfigHome(env).resolve("config");
    }

    public static Path defaultJobsPath(Map<String, String> env)
    {
        return nightlyConfigHome(env).resolve("jobs.json");
    }

    public static Path nightlyConfigHome(Map<String, String> env)
    {
        String nightlyConfigHomeEnv = env.get("NIGHTLY_CONFIG_HOME");
        if (nightlyConfigHomeEnv != null) {
            return Paths.get(nightlyConfigHomeEnv);
        }
        return configHome(env).resolve("nightly");
    }

    private static Path configHome(Map<String, String> env)
    {
        String configHome = env.get("XDG_CONFIG_HOME");
        if (configHome != null) {
            return Paths.get(configHome);
        }
        return Paths.get(System.getProperty("user.home"), ".config");
    }
}
