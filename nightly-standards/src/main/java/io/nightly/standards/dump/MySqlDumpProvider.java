package io.nightly.standards.dump;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import com.google.common.collect.ImmutableList;

/**
 * Dumps MySQL and MariaDB with the server's own {@code SHOW CREATE TABLE}
 * output, so indexes, engines and charsets are kept.
 */
public class MySqlDumpProvider
        extends JdbcDumpProvider
{
    public MySqlDumpProvider(Connection connection)
    {
        super(connection);
    }

    @Override
    public List<String> listTables()
    {
        ImmutableList.Builder<String> tables = ImmutableList.builder();
        try (Statement stmt = connection.createStatement();
                ResultSet rs = stmt.executeQuery("SHOW TABLES")) {
            while (rs.next()) {
                tables.add(rs.getString(1));
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
        try (Statement stmt = connection.createStatement();
                ResultSet rs = stmt.executeQuery("SHOW CREATE TABLE " + escapeIdent(tableName))) {
            if (!rs.next()) {
                throw new DatabaseException("Table not found: " + tableName);
            }
            return rs.getString(2);
        }
        catch (SQLException ex) {
            throw new DatabaseException("Failed to read definition of table " + tableName, ex);
        }
    }

    @Override
    protected int fetchSize()
    {
        // makes Connector/J stream rows instead of loading the whole table
        return Integer.MIN_VALUE;
    }

    @Override
    public String escapeIdent(String ident)
    {
        return "`" + ident.replace("`", "``") + "`";
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
        String s = value.toString();
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('\'');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
            case '\0':
                sb.append("\\0");
                break;
            case '\n':
                sb.append("\\n");
                break;
            case '\r':
                sb.append("\\r");
                break;
            case '\\':
                sb.append("\\\\");
                break;
            case '\'':
                sb.append("\\'");
                break;
            case '"':
                sb.append("\\\"");
                break;
            case '\u001a':
                sb.append("\\Z");
                break;
            default:
                sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }
}
