package io.nightly.core.repository;

import java.util.List;
import com.google.common.collect.ImmutableList;

import static java.util.Locale.ENGLISH;

public class ModelValidationException
    extends IllegalStateException
{
    public static class Failure
    {
        private final String fieldName;
        private final Object object;
        private final String message;

        public Failure(String fieldName, Object object, String message)
        {
            this.fieldName = fieldName;
            this.object = object;
            this.message = message;
        }

        public String getFieldName()
        {
            return fieldName;
        }

        public Object getObject()
        {
            return object;
        }

        public String getMessage()
        {
            return message;
        }

        @Override
        public String toString()
        {
            return String.format(ENGLISH, "%s %s (given: %s)",
                    fieldName, message, object == null ? "none" : "\"" + object + "\"");
        }
    }

    private final Object modelObject;
    private final List<Failure> failures;

    public ModelValidationException(String message, Object modelObject, List<Failure> failures)
    {
        super(buildMessage(message, failures));
        this.modelObject = modelObject;
        this.failures = ImmutableList.copyOf(failures);
    }

    private static String buildMessage(String message, List<Failure> failures)
    {
        StringBuilder sb = new StringBuilder(message).append(':');
        for (Failure failure : failures) {
            sb.append("\n  ").append(failure);
        }
        return sb.toString();
    }

    public Object getModelObject()
    {
        return modelObject;
    }

    public List<Failure> getFailures()
    {
        return failures;
    }
}
