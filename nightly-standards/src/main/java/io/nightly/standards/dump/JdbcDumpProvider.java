package io.nightly.standards.dump;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import io.nightly.spi.DumpProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Locale.ENGLISH;

/**
 * Dumps any JDBC database using {@link DatabaseMetaData}.
 *
 * Table definitions are rebuilt from column metadata so they carry column
 * types, nullability and the primary key but no indexes or constraints.
 */
public class JdbcDumpProvider
        implements DumpProvider
{
    private static final Logger logger = LoggerFactory.getLogger(JdbcDumpProvider.class);

    private static final String[] TABLE_TYPES = new String[] {"TABLE", "BASE TABLE"};

    protected final Connection connection;

    private String quoteString;

    public JdbcDumpProvider(Connection connection)
    {
        this.connection = connection;
    }

    @Override
    public List<String> listTables()
    {
        ImmutableList.Builder<String> tables = ImmutableList.builder();
        try {
            DatabaseMetaData meta = connection.getMetaData();
            try (ResultSet rs = meta.getTables(connection.getCatalog(), connection.getSchema(), "%", TABLE_TYPES)) {
                while (rs.next()) {
                    tables.add(rs.getString("TABLE_NAME"));
                }
            }
        }
        catch (SQLException ex) {
            throw new DatabaseException("Failed to list tables", ex);
        }
        return tables.build();
    }

    @Override
    public String schemaOf(String tableName)
    {
        List<String> lines = new ArrayList<>();
        try {
            DatabaseMetaData meta = connection.getMetaData();
            String pattern = escapePattern(tableName, meta.getSearchStringEscape());
            try (ResultSet rs = meta.getColumns(connection.getCatalog(), connection.getSchema(), pattern, "%")) {
                while (rs.next()) {
                    // some drivers ignore the escape character
                    if (tableName.equals(rs.getString("TABLE_NAME"))) {
                        lines.add("  " + columnDefinition(rs));
                    }
                }
            }
            List<String> keys = new ArrayList<>();
            try (ResultSet rs = meta.getPrimaryKeys(connection.getCatalog(), connection.getSchema(), tableName)) {
                while (rs.next()) {
                    keys.add(escapeIdent(rs.getString("COLUMN_NAME")));
                }
            }
            if (!keys.isEmpty()) {
                lines.add("  PRIMARY KEY (" + Joiner.on(", ").join(keys) + ")");
            }
        }
        catch (SQLException ex) {
            throw new DatabaseException("Failed to read definition of table " + tableName, ex);
        }
        if (lines.isEmpty()) {
            throw new DatabaseException("Table not found: " + tableName);
        }
        return "CREATE TABLE " + escapeIdent(tableName) + " (\n" + Joiner.on(",\n").join(lines) + "\n)";
    }

    static String escapePattern(String name, String escape)
    {
        if (escape == null || escape.isEmpty()) {
            return name;
        }
        return name.replace(escape, escape + escape)
            .replace("_", escape + "_")
            .replace("%", escape + "%");
    }

    private String columnDefinition(ResultSet column)
        throws SQLException
    {
        StringBuilder sb = new StringBuilder();
        sb.append(escapeIdent(column.getString("COLUMN_NAME")));
        sb.append(' ').append(column.getString("TYPE_NAME"));
        switch (column.getInt("DATA_TYPE")) {
        case Types.CHAR:
        case Types.VARCHAR:
        case Types.NCHAR:
        case Types.NVARCHAR:
        case Types.BINARY:
        case Types.VARBINARY:
            sb.append('(').append(column.getInt("COLUMN_SIZE")).append(')');
            break;
        case Types.DECIMAL:
        case Types.NUMERIC:
            sb.append('(').append(column.getInt("COLUMN_SIZE"))
                .append(',').append(column.getInt("DECIMAL_DIGITS")).append(')');
            break;
        default:
            break;
        }
        if (column.getInt("NULLABLE") == DatabaseMetaData.columnNoNulls) {
            sb.append(" NOT NULL");
        }
        String defaultValue = column.getString("COLUMN_DEF");
        if (defaultValue != null) {
            sb.append(" DEFAULT ").append(defaultValue);
        }
        return sb.toString();
    }

    @Override
    public Stream<Map<String, Object>> rowsOf(String tableName)
    {
        Statement stmt = null;
        try {
            stmt = connection.createStatement();
            stmt.setFetchSize(fetchSize());
            ResultSet rs = stmt.executeQuery("SELECT * FROM " + escapeIdent(tableName));
            Statement statement = stmt;
            return StreamSupport.stream(new RowSpliterator(tableName, rs), false)
                .onClose(() -> closeQuietly(statement));
        }
        catch (SQLException ex) {
            closeQuietly(stmt);
            throw new DatabaseException("Failed to read rows of table " + tableName, ex);
        }
    }

    protected int fetchSize()
    {
        return 1000;
    }

    private static class RowSpliterator
            extends Spliterators.AbstractSpliterator<Map<String, Object>>
    {
        private final String tableName;
        private final ResultSet rs;

        RowSpliterator(String tableName, ResultSet rs)
        {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.tableName = tableName;
            this.rs = rs;
        }

        @Override
        public boolean tryAdvance(Consumer<? super Map<String, Object>> action)
        {
            try {
                if (!rs.next()) {
                    return false;
                }
                ResultSetMetaData meta = rs.getMetaData();
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    row.put(meta.getColumnLabel(i), readValue(rs, i, meta.getColumnType(i)));
                }
                action.accept(row);
                return true;
            }
            catch (SQLException ex) {
                throw new DatabaseException("Failed to read a row of table " + tableName, ex);
            }
        }
    }

    private static Object readValue(ResultSet rs, int index, int type)
        throws SQLException
    {
        switch (type) {
        case Types.BINARY:
        case Types.VARBINARY:
        case Types.LONGVARBINARY:
        case Types.BLOB:
            return rs.getBytes(index);
        default:
            return rs.getString(index);
        }
    }

    private static void closeQuietly(Statement stmt)
    {
        if (stmt == null) {
            return;
        }
        try {
            stmt.close();
        }
        catch (SQLException ex) {
            logger.warn("Failed to close a statement. Ignoring.", ex);
        }
    }

    @Override
    public String escapeIdent(String ident)
    {
        if (quoteString == null) {
            try {
                quoteString = connection.getMetaData().getIdentifierQuoteString().trim();
            }
            catch (SQLException ex) {
                throw new DatabaseException("Failed to retrieve database metadata to quote an identifier name", ex);
            }
        }
        if (quoteString.isEmpty()) {
            // identifier quoting is not supported
            return ident;
        }
        return quoteString + ident.replaceAll(Pattern.quote(quoteString), quoteString + quoteString) + quoteString;
    }

    @Override
    public String escapeValue(Object value)
    {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof byte[]) {
            return hexLiteral((byte[]) value);
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }

    protected static String hexLiteral(byte[] bytes)
    {
        return String.format(ENGLISH, "X'%s'", BaseEncoding.base16().lowerCase().encode(bytes));
    }

    @Override
    public void close()
    {
        try {
            connection.close();
        }
        catch (SQLException ex) {
            logger.warn("Failed to close a database connection. Ignoring.", ex);
        }
    }
}
