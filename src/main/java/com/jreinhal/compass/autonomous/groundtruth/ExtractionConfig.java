package com.jreinhal.compass.autonomous.groundtruth;

import java.util.List;

/**
 * Column mapping for ground-truth extraction. When {@code fields} is empty every column
 * except the key and period columns is extracted.
 */
public record ExtractionConfig(
        String schemaId,
        String documentId,
        String keyColumn,
        String periodColumn,
        List<String> fields,
        double minConfidence,
        boolean skipNullKeys) {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.5;

    public ExtractionConfig {
        if (keyColumn == null || keyColumn.isBlank()) {
            throw new IllegalArgumentException("keyColumn is required");
        }
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static ExtractionConfig of(String schemaId, String documentId, String keyColumn, String periodColumn) {
        return new ExtractionConfig(schemaId, documentId, keyColumn, periodColumn, List.of(), DEFAULT_MIN_CONFIDENCE, true);
    }

    public ExtractionConfig withFields(List<String> selected) {
        return new ExtractionConfig(schemaId, documentId, keyColumn, periodColumn, selected, minConfidence, skipNullKeys);
    }

    public ExtractionConfig withMinConfidence(double threshold) {
        return new ExtractionConfig(schemaId, documentId, keyColumn, periodColumn, fields, threshold, skipNullKeys);
    }
}
