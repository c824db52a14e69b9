package io.nightly.core.backup;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;
import io.nightly.spi.DumpProvider;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Writes a plain SQL dump: for each table its create statement followed by
 * one INSERT statement per row.
 */
public class DumpWriter
{
    public void write(DumpProvider provider, Path destination)
        throws IOException
    {
        try (BufferedWriter out = Files.newBufferedWriter(destination, UTF_8)) {
            for (String table : provider.listTables()) {
                writeTable(provider, table, out);
            }
        }
    }

    private void writeTable(DumpProvider provider, String table, Writer out)
        throws IOException
    {
        out.write("\n\n");
        out.write(provider.schemaOf(table));
        out.write(";\n\n");

        String insert = "INSERT INTO " + provider.escapeIdent(table) + " VALUES (";
        try (Stream<Map<String, Object>> rows = provider.rowsOf(table)) {
            Iterator<Map<String, Object>> ite = rows.iterator();
            while (ite.hasNext()) {
                Map<String, Object> row = ite.next();
                StringBuilder sb = new StringBuilder(insert);
                boolean first = true;
                for (Object value : row.values()) {
                    if (!first) {
                        sb.append(',');
                    }
                    sb.append(provider.escapeValue(value));
                    first = false;
                }
                sb.append(");\n");
                out.write(sb.toString());
            }
        }
    }
}
