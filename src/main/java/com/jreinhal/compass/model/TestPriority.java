package com.jreinhal.compass.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Accuracy test priority. Suites run higher weights first.
 */
public enum TestPriority {
    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    TestPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
