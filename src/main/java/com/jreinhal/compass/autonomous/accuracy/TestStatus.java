package com.jreinhal.compass.autonomous.accuracy;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * {@link #ERROR} means the query could not be executed at all, which is distinct from an
 * answer that was wrong.
 */
public enum TestStatus {
    PASSED,
    FAILED,
    ERROR;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
