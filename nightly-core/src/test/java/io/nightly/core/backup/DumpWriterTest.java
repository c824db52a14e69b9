package io.nightly.core.backup;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class DumpWriterTest
{
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private static Map<String, Object> row(Object... values)
    {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            row.put("c" + i, values[i]);
        }
        return row;
    }

    @Test
    public void writesSchemaThenInserts()
        throws Exception
    {
        FakeDumpProvider provider = new FakeDumpProvider()
            .addTable("users", "CREATE TABLE `users` (`id` int, `name` text)")
            .addRow("users", row(1, "alice"))
            .addRow("users", row(2, "o'brien"))
            .addTable("empty", "CREATE TABLE `empty` (`id` int)")
            .addTable("notes", "CREATE TABLE `notes` (`body` text)")
            .addRow("notes", row((Object) null));

        Path out = folder.getRoot().toPath().resolve("dump.sql");
        new DumpWriter().write(provider, out);

        String expected =
            "\n\nCREATE TABLE `users` (`id` int, `name` text);\n\n" +
            "INSERT INTO `users` VALUES ('1','alice');\n" +
            "INSERT INTO `users` VALUES ('2','o''brien');\n" +
            "\n\nCREATE TABLE `empty` (`id` int);\n\n" +
            "\n\nCREATE TABLE `notes` (`body` text);\n\n" +
            "INSERT INTO `notes` VALUES (NULL);\n";
        assertThat(new String(Files.readAllBytes(out), UTF_8), is(expected));
        assertThat(provider.getOpenStreams(), is(0));
    }

    @Test
    public void emptyDatabaseWritesEmptyFile()
        throws Exception
    {
        Path out = folder.getRoot().toPath().resolve("dump.sql");
        new DumpWriter().write(new FakeDumpProvider(), out);
        assertThat(Files.size(out), is(0L));
    }
}
