package com.jreinhal.compass.calculation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Value of an evaluated calculation plus the intermediate numbers that produced it.
 * Values are not rounded.
 */
public record CalculationResult(CalculationType type, double value, Map<String, Object> breakdown) {

    public CalculationResult {
        breakdown = breakdown == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }
}
