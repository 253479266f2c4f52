package com.jreinhal.compass.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ComparisonType {
    EXACT,
    NUMERIC_RANGE,
    CONTAINS,
    REGEX,
    BOOLEAN_CHECK;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
