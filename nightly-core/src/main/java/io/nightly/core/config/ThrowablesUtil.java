package io.nightly.core.config;

import com.google.common.base.Throwables;

public class ThrowablesUtil
{
    private ThrowablesUtil()
    { }

    /**
     * Rethrows unchecked exceptions as-is and wraps checked ones in a RuntimeException.
     */
    public static RuntimeException propagate(Throwable throwable)
    {
        Throwables.throwIfUnchecked(throwable);
        throw new RuntimeException(throwable);
    }

    public static <X extends Throwable> void propagateIfInstanceOf(Throwable throwable, Class<X> declaredType)
            throws X
    {
        if (throwable != null) {
            Throwables.throwIfInstanceOf(throwable, declaredType);
        }
    }
}
