package io.nightly.core.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import com.google.common.io.ByteStreams;
import io.nightly.core.backup.BackupConfig;
import io.nightly.core.repository.Cadence;
import io.nightly.core.repository.Job;
import io.nightly.core.repository.MemoryJobStore;
import io.nightly.core.repository.ResourceNotFoundException;
import io.nightly.core.repository.StorageMode;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static io.nightly.core.JobFixtures.definition;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class BackupFileManagerTest
{
    private static final String EMAIL_BACKUP = "backup--job_1--daily--2024-01-10_02-00-00.sql.zip";
    private static final String ORPHAN_BACKUP = "backup--job_9--weekly--2024-01-08_03-00-00.sql";

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private Path dir;
    private BackupFileManager manager;

    @Before
    public void setUp()
        throws IOException
    {
        dir = folder.getRoot().toPath();
        MemoryJobStore store = new MemoryJobStore();
        store.putJob(Job.of("job_1", definition(Cadence.DAILY, 2, 0)
                    .storage(StorageMode.EMAIL)
                    .email("dba@example.com")
                    .build()));
        manager = new BackupFileManager(BackupConfig.defaultBuilder().backupDir(dir).build(), store);

        write(EMAIL_BACKUP, "zipped", "2024-01-10T02:00:10Z");
        write(ORPHAN_BACKUP, "plain dump", "2024-01-08T03:00:10Z");
        write("notes.txt", "", "2024-01-01T00:00:00Z");
    }

    private void write(String name, String content, String mtime)
        throws IOException
    {
        Path path = dir.resolve(name);
        Files.write(path, content.getBytes(UTF_8));
        Files.setLastModifiedTime(path, FileTime.from(Instant.parse(mtime)));
    }

    @Test
    public void listsArtifactsNewestFirst()
        throws IOException
    {
        List<BackupFile> files = manager.listFiles();

        assertThat(files.size(), is(2));

        BackupFile first = files.get(0);
        assertThat(first.getFileName(), is(EMAIL_BACKUP));
        assertThat(first.getName().getJobId(), is("job_1"));
        assertThat(first.getName().getCadence(), is(Cadence.DAILY));
        assertThat(first.getStorage(), is("email"));
        assertThat(first.getSize(), is(6L));
        assertThat(first.getModifiedAt(), is(Instant.parse("2024-01-10T02:00:10Z")));

        BackupFile second = files.get(1);
        assertThat(second.getFileName(), is(ORPHAN_BACKUP));
        assertThat(second.getStorage(), is(BackupFileManager.UNKNOWN_STORAGE));
    }

    @Test
    public void emptyWhenDirectoryIsMissing()
        throws IOException
    {
        BackupFileManager manager = new BackupFileManager(
                BackupConfig.defaultBuilder().backupDir(dir.resolve("missing")).build(),
                new MemoryJobStore());
        assertThat(manager.listFiles().isEmpty(), is(true));
    }

    @Test
    public void openStreamsFileContent()
        throws Exception
    {
        try (InputStream in = manager.openFile(ORPHAN_BACKUP)) {
            assertThat(new String(ByteStreams.toByteArray(in), UTF_8), is("plain dump"));
        }
        assertThat(manager.getFileSize(ORPHAN_BACKUP), is(10L));
    }

    @Test
    public void deleteRemovesFile()
        throws Exception
    {
        manager.deleteFile(EMAIL_BACKUP);
        assertThat(Files.exists(dir.resolve(EMAIL_BACKUP)), is(false));
    }

    @Test(expected = ResourceNotFoundException.class)
    public void deleteMissingFile()
        throws Exception
    {
        manager.deleteFile("backup--job_1--daily--2023-01-10_02-00-00.sql.zip");
    }

    @Test(expected = ResourceNotFoundException.class)
    public void openMissingFile()
        throws Exception
    {
        manager.openFile("backup--job_1--daily--2023-01-10_02-00-00.sql.zip");
    }

    @Test(expected = IllegalArgumentException.class)
    public void pathTraversalIsRejected()
        throws Exception
    {
        manager.openFile("../" + ORPHAN_BACKUP);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonArchiveNameIsRejected()
        throws Exception
    {
        manager.deleteFile("notes.txt");
    }
}
