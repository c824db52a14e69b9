package io.nightly.standards.archive;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import com.google.common.io.ByteStreams;
import io.nightly.spi.ArchiveException;
import io.nightly.spi.ArchiveFormat;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;

public class CompressArchiveProviderTest
{
    private static final String DUMP = "\n\nCREATE TABLE `t` (`id` int);\n\nINSERT INTO `t` VALUES ('1');\n";

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private final CompressArchiveProvider provider = new CompressArchiveProvider();

    private Path source;

    @Before
    public void setUp()
        throws Exception
    {
        source = folder.getRoot().toPath().resolve("backup--job_1--daily--2024-01-10_02-00-05.sql");
        Files.write(source, DUMP.getBytes(UTF_8));
    }

    @Test
    public void zipHoldsSourceUnderItsName()
        throws Exception
    {
        Path zip = source.resolveSibling(source.getFileName() + ".zip");
        provider.compress(ArchiveFormat.ZIP, source, zip);

        assertThat(Files.exists(source), is(true));
        try (ZipFile file = new ZipFile(zip.toFile())) {
            ZipArchiveEntry entry = file.getEntry(source.getFileName().toString());
            try (InputStream in = file.getInputStream(entry)) {
                assertThat(new String(ByteStreams.toByteArray(in), UTF_8), is(DUMP));
            }
        }
    }

    @Test
    public void tarHoldsSourceUnderItsName()
        throws Exception
    {
        Path tar = source.resolveSibling(source.getFileName() + ".tar");
        provider.compress(ArchiveFormat.TAR, source, tar);

        try (TarArchiveInputStream in = new TarArchiveInputStream(Files.newInputStream(tar))) {
            TarArchiveEntry entry = in.getNextTarEntry();
            assertThat(entry.getName(), is(source.getFileName().toString()));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ByteStreams.copy(in, out);
            assertThat(new String(out.toByteArray(), UTF_8), is(DUMP));
            assertThat(in.getNextTarEntry(), is(nullValue()));
        }
    }

    @Test
    public void missingSourceLeavesNoArchive()
    {
        Path missing = folder.getRoot().toPath().resolve("missing.sql");
        Path zip = folder.getRoot().toPath().resolve("missing.sql.zip");
        try {
            provider.compress(ArchiveFormat.ZIP, missing, zip);
            fail();
        }
        catch (ArchiveException ex) {
            assertThat(Files.exists(zip), is(false));
        }
    }

    @Test
    public void existingArchiveIsNotOverwritten()
        throws Exception
    {
        Path zip = source.resolveSibling(source.getFileName() + ".zip");
        Files.write(zip, "keep".getBytes(UTF_8));
        try {
            provider.compress(ArchiveFormat.ZIP, source, zip);
            fail();
        }
        catch (ArchiveException ex) {
            assertThat(new String(Files.readAllBytes(zip), UTF_8), is("keep"));
        }
    }

    @Test(expected = ArchiveException.class)
    public void noneIsNotAnArchive()
        throws Exception
    {
        provider.compress(ArchiveFormat.NONE, source, source.resolveSibling("x"));
    }
}
