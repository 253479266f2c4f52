package com.jreinhal.compass.autonomous.accuracy;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
