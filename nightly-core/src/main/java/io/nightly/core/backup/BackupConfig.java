package io.nightly.core.backup;

import java.nio.file.Path;
import java.nio.file.Paths;
import io.nightly.core.config.Config;
import io.nightly.core.repository.Cadence;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

@Value.Immutable
@JsonSerialize(as = ImmutableBackupConfig.class)
@JsonDeserialize(as = ImmutableBackupConfig.class)
public interface BackupConfig
{
    Path getBackupDir();

    int getDailyRetention();

    int getWeeklyRetention();

    int getMonthlyRetention();

    String getSubjectPrefix();

    /**
     * Maximum number of artifacts kept per job of the cadence.
     */
    default int getRetentionLimit(Cadence cadence)
    {
        switch (cadence) {
        case DAILY:
            return getDailyRetention();
        case WEEKLY:
            return getWeeklyRetention();
        default:
            return getMonthlyRetention();
        }
    }

    @Value.Check
    default void check()
    {
        checkState(getDailyRetention() > 0, "retention.daily must be positive");
        checkState(getWeeklyRetention() > 0, "retention.weekly must be positive");
        checkState(getMonthlyRetention() > 0, "retention.monthly must be positive");
    }

    static ImmutableBackupConfig.Builder defaultBuilder()
    {
        return ImmutableBackupConfig.builder()
            .backupDir(Paths.get("db-backups"))
            .dailyRetention(30)
            .weeklyRetention(12)
            .monthlyRetention(12)
            .subjectPrefix("Database Backup");
    }

    static BackupConfig convertFrom(Config config)
    {
        return defaultBuilder()
            .backupDir(Paths.get(config.get("backup.dir", String.class, "db-backups")).toAbsolutePath())
            .dailyRetention(config.get("retention.daily", int.class, 30))
            .weeklyRetention(config.get("retention.weekly", int.class, 12))
            .monthlyRetention(config.get("retention.monthly", int.class, 12))
            .subjectPrefix(config.get("mail.subject_prefix", String.class, "Database Backup"))
            .build();
    }
}
