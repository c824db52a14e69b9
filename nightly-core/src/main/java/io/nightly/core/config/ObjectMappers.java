package io.nightly.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class ObjectMappers
{
    private ObjectMappers()
    { }

    public static ObjectMapper create()
    {
        return configure(new ObjectMapper());
    }

    public static ObjectMapper configure(ObjectMapper mapper)
    {
        return mapper
            .registerModule(new GuavaModule())
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
