package com.jreinhal.compass.understanding;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum IntentType {
    DIRECT_LOOKUP,
    CALCULATION,
    COMPARISON,
    AGGREGATION,
    GENERAL_QA;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup for model output. Unknown values map to {@link #GENERAL_QA}.
     */
    public static IntentType fromId(String id) {
        if (id == null) {
            return GENERAL_QA;
        }
        for (IntentType type : values()) {
            if (type.id().equalsIgnoreCase(id.trim())) {
                return type;
            }
        }
        return GENERAL_QA;
    }
}
