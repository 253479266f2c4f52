package com.jreinhal.compass.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum OptimizationActionType {
    SCHEMA_UPDATE,
    EMBEDDING_UPDATE,
    FILTER_FIX,
    METADATA_ADD,
    FIELD_ALIAS,
    QUERY_PATTERN;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
