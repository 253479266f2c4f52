package com.jreinhal.compass.schema;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Schema discovered at runtime for one namespace.
 */
public record DynamicSchema(
        TemplateType templateType,
        TemplateInference templateInference,
        String namespace,
        List<DiscoveredField> fields,
        List<DiscoveredCalculation> calculations,
        List<String> examples,
        long vectorCount,
        Instant lastUpdated,
        Instant lastDiscoveredAt) {

    public DynamicSchema {
        fields = fields == null ? List.of() : List.copyOf(fields);
        calculations = calculations == null ? List.of() : List.copyOf(calculations);
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public Set<String> fieldNames() {
        return fields.stream().map(DiscoveredField::name).collect(Collectors.toUnmodifiableSet());
    }

    public Optional<DiscoveredField> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public boolean hasField(String name) {
        return field(name).isPresent();
    }

    public List<DiscoveredCalculation> availableCalculations() {
        return calculations.stream().filter(DiscoveredCalculation::available).toList();
    }
}
