package com.jreinhal.compass.schema;

import java.util.List;
import java.util.Map;

/**
 * Outcome of discovering several namespaces. {@code failures} maps a namespace to the error
 * that stopped its discovery; the remaining schemas are still returned.
 */
public record SchemaDiscoveryResult(
        List<DynamicSchema> schemas,
        Map<String, String> failures,
        int totalFields,
        long totalVectors,
        long discoveryTimeMs) {

    public SchemaDiscoveryResult {
        schemas = schemas == null ? List.of() : List.copyOf(schemas);
        failures = failures == null ? Map.of() : Map.copyOf(failures);
    }

    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
