package io.nightly.spi;

public class ArchiveException
        extends Exception
{
    public ArchiveException(String message)
    {
        super(message);
    }

    public ArchiveException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
