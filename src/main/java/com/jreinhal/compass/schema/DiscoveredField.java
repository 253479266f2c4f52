package com.jreinhal.compass.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * A metadata field observed while sampling a namespace.
 */
public record DiscoveredField(
        String name,
        FieldType type,
        String description,
        String displayName,
        List<MetadataValue> examples,
        double frequency,
        FieldCategory category,
        List<String> aliases) {

    public DiscoveredField {
        examples = examples == null ? List.of() : List.copyOf(examples);
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    @JsonIgnore
    public boolean isNumeric() {
        return type == FieldType.NUMBER;
    }
}
