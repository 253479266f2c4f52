package com.jreinhal.compass.schema;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Data template a namespace (or a query) belongs to.
 */
public enum TemplateType {
    COMPENSATION("수수료/커미션"),
    MDRT("MDRT 현황"),
    GENERAL("일반 정보");

    private final String displayName;

    TemplateType(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Lenient lookup used when normalising LLM output. Unknown values map to {@link #GENERAL}.
     */
    public static TemplateType fromId(String id) {
        if (id == null) {
            return GENERAL;
        }
        for (TemplateType type : values()) {
            if (type.id().equalsIgnoreCase(id.trim())) {
                return type;
            }
        }
        return GENERAL;
    }
}
