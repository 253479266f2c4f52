package com.jreinhal.compass.calculation;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * Named calculations the engine knows how to evaluate.
 */
public enum CalculationType {
    MDRT_GAP,
    PERIOD_DIFF,
    SUM,
    AVERAGE,
    COUNT,
    PERCENTAGE,
    TAX_REVERSE;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CalculationType> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        for (CalculationType type : values()) {
            if (type.id().equalsIgnoreCase(id.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
