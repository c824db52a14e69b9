package io.nightly.spi;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * A read-only view of one database connection.
 *
 * Implementations are not thread-safe. Callers close the provider once the dump is written.
 */
public interface DumpProvider
        extends AutoCloseable
{
    List<String> listTables();

    /**
     * Returns the statement that recreates the table, without a trailing semicolon.
     */
    String schemaOf(String tableName);

    /**
     * Streams rows lazily in column order. The returned stream holds database
     * resources and must be closed.
     */
    Stream<Map<String, Object>> rowsOf(String tableName);

    String escapeIdent(String ident);

    /**
     * Renders a value as a SQL literal of this dialect, including quotes.
     */
    String escapeValue(Object value);

    @Override
    void close();
}
