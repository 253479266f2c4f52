package com.jreinhal.compass.schema;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Semantic type of a discovered metadata field.
 */
public enum FieldType {
    NUMBER,
    STRING,
    BOOLEAN,
    DATE,
    ARRAY;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
