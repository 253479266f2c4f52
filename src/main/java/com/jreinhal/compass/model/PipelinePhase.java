package com.jreinhal.compass.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum PipelinePhase {
    ANALYZING,
    DISCOVERING_SCHEMA,
    GROUND_TRUTH,
    TESTING,
    OPTIMIZING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
