package com.jreinhal.compass.vector;

import java.util.Map;

public record VectorRecord(String id, float[] values, Map<String, Object> metadata) {

    public VectorRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Vector id must not be blank");
        }
        metadata = metadata == null ? Map.of() : metadata;
    }
}
