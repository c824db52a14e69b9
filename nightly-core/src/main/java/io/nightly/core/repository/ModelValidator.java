package io.nightly.core.repository;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public class ModelValidator
{
    public static ModelValidator builder()
    {
        return new ModelValidator();
    }

    private static final Pattern EMAIL_ADDRESS = Pattern.compile("^[^@\\s]+@[^@\\s]+$");

    private final List<ModelValidationException.Failure> failures = new ArrayList<>();

    private ModelValidator()
    { }

    public ModelValidator error(String fieldName, Object object, String errorMessage)
    {
        failures.add(new ModelValidationException.Failure(fieldName, object, errorMessage));
        return this;
    }

    public ModelValidator check(String fieldName, Object object, boolean expression, String errorMessage)
    {
        if (!expression) {
            error(fieldName, object, errorMessage);
        }
        return this;
    }

    public ModelValidator checkNotEmpty(String fieldName, String value)
    {
        return check(fieldName, value, !value.trim().isEmpty(), "must not be blank");
    }

    public ModelValidator checkMaxLength(String fieldName, String value, int max)
    {
        return check(fieldName, value, value.length() <= max, "must not be longer than " + max + " characters");
    }

    public ModelValidator checkRange(String fieldName, int value, int min, int max)
    {
        return check(fieldName, value, min <= value && value <= max, "must be between " + min + " and " + max);
    }

    public ModelValidator checkEmailAddress(String fieldName, String value)
    {
        checkNotEmpty(fieldName, value);
        check(fieldName, value, EMAIL_ADDRESS.matcher(value).matches(), "must be an email address");
        checkMaxLength(fieldName, value, 254);
        return this;
    }

    public ModelValidator checkJobDefinition(JobDefinition def)
    {
        checkNotEmpty("title", def.getTitle());
        checkMaxLength("title", def.getTitle(), 255);
        switch (def.getCadence()) {
        case WEEKLY:
            check("weekday", def.getWeekday().orNull(), def.getWeekday().isPresent(), "is required for a weekly job");
            break;
        case MONTHLY:
            if (def.getDayOfMonth().isPresent()) {
                checkRange("day_of_month", def.getDayOfMonth().get(), 1, 31);
            }
            else {
                error("day_of_month", null, "is required for a monthly job");
            }
            break;
        default:
            break;
        }
        if (def.getStorage() == StorageMode.EMAIL) {
            if (def.getEmail().isPresent()) {
                checkEmailAddress("email", def.getEmail().get());
            }
            else {
                error("email", null, "is required when storage is email");
            }
        }
        return this;
    }

    public void validate(String modelType, Object modelObject)
    {
        if (!failures.isEmpty()) {
            throw new ModelValidationException("Validating "+ modelType + " failed", modelObject, failures);
        }
    }
}
