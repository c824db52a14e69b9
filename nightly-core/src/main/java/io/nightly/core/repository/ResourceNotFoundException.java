package io.nightly.core.repository;

/**
 * An exception thrown when a job or a backup file does not exist.
 *
 * This exception is deterministic.
 */
public class ResourceNotFoundException extends Exception
{
    public ResourceNotFoundException(String message)
    {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
