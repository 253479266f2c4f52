package com.jreinhal.compass.schema;

import com.jreinhal.compass.calculation.CalculationType;
import java.util.Collection;
import java.util.List;

/**
 * A calculation the schema can support. {@code available} is derived from the field set
 * through {@link #deriveFor(Collection)} and never set independently.
 */
public record DiscoveredCalculation(
        CalculationType type,
        String name,
        String description,
        List<String> requiredFields,
        boolean available) {

    public DiscoveredCalculation {
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    }

    static DiscoveredCalculation definition(CalculationType type, String name, String description, List<String> requiredFields) {
        return new DiscoveredCalculation(type, name, description, requiredFields, requiredFields.isEmpty());
    }

    public DiscoveredCalculation deriveFor(Collection<String> fieldNames) {
        boolean derived = requiredFields.isEmpty() || fieldNames.containsAll(requiredFields);
        return new DiscoveredCalculation(type, name, description, requiredFields, derived);
    }
}
