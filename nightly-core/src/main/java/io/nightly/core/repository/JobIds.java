package io.nightly.core.repository;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

import static java.util.Locale.ENGLISH;

/**
 * Generates job ids such as {@code job_65a1b2c3d4e5f.12345678}.
 *
 * An id consists of the {@code job_} prefix, 13 hexadecimal digits of the
 * creation time in microseconds, a dot and 8 random decimal digits. Ids use
 * only {@code [A-Za-z0-9_.]} so they never contain the archive name delimiter.
 */
public class JobIds
{
    private static final String PREFIX = "job_";

    private JobIds()
    { }

    public static String generate(Instant now)
    {
        long seconds = now.getEpochSecond();
        long micros = now.getNano() / 1000;
        int random = ThreadLocalRandom.current().nextInt(100000000);
        return String.format(ENGLISH, "%s%08x%05x.%08d", PREFIX, seconds, micros, random);
    }
}
