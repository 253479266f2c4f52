package com.jreinhal.compass.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum UpdateReason {
    DOCUMENT_UPLOAD,
    DOCUMENT_DELETE,
    MANUAL_REFRESH,
    SCHEMA_OPTIMIZATION,
    INITIAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
