package io.nightly.standards.dump;

import java.sql.SQLException;

public class DatabaseException
        extends RuntimeException
{
    public DatabaseException(String message)
    {
        super(message);
    }

    public DatabaseException(String message, SQLException cause)
    {
        super(message, cause);
    }

    @Override
    public synchronized SQLException getCause()
    {
        return (SQLException) super.getCause();
    }
}
