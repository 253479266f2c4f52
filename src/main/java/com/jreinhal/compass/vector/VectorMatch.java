package com.jreinhal.compass.vector;

import com.jreinhal.compass.schema.MetadataValue;
import java.util.Map;

public record VectorMatch(String id, double score, Map<String, Object> metadata) {

    public VectorMatch {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public MetadataValue value(String key) {
        return MetadataValue.of(metadata.get(key));
    }
}
