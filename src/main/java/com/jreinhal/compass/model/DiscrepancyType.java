package com.jreinhal.compass.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DiscrepancyType {
    MISSING,
    WRONG_VALUE,
    FORMAT_MISMATCH,
    TYPE_MISMATCH,
    WITHIN_TOLERANCE;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
