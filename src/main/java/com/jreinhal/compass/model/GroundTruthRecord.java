package com.jreinhal.compass.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Known-correct field values for one entity (an employee in a period), extracted from a
 * source sheet. Records are invalidated when their document changes; they are never deleted.
 */
@Document(collection = "ground_truth")
@CompoundIndex(name = "schema_valid_idx", def = "{'schemaId': 1, 'valid': 1}")
public class GroundTruthRecord {

    @Id
    private String id;
    private String schemaId;
    @Indexed
    private String documentId;
    private Map<String, String> entityIdentifier = new LinkedHashMap<>();
    private Map<String, FieldValue> fieldValues = new LinkedHashMap<>();
    private double confidence;
    private boolean valid = true;
    private Instant invalidatedAt;
    private String invalidatedReason;
    private Instant createdAt;

    /**
     * One extracted cell. {@code source} locates the cell as {@code Sheet!RowN}.
     */
    public record FieldValue(Object value, double confidence, String source, Instant extractedAt) {}

    public GroundTruthRecord() {
        this.createdAt = Instant.now();
    }

    public GroundTruthRecord(String schemaId, String documentId, Map<String, String> entityIdentifier,
                             Map<String, FieldValue> fieldValues, Instant createdAt) {
        this.schemaId = schemaId;
        this.documentId = documentId;
        this.entityIdentifier = new LinkedHashMap<>(entityIdentifier);
        this.fieldValues = new LinkedHashMap<>(fieldValues);
        this.confidence = fieldValues.values().stream().mapToDouble(FieldValue::confidence).min().orElse(0.0);
        this.createdAt = createdAt;
    }

    public void invalidate(String reason, Instant at) {
        this.valid = false;
        this.invalidatedReason = reason;
        this.invalidatedAt = at;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getSchemaId() { return schemaId; }
    public void setSchemaId(String schemaId) { this.schemaId = schemaId; }
    public String getDocumentId() { return documentId; }
    public void setDocumentId(String documentId) { this.documentId = documentId; }
    public Map<String, String> getEntityIdentifier() { return entityIdentifier; }
    public void setEntityIdentifier(Map<String, String> entityIdentifier) { this.entityIdentifier = entityIdentifier; }
    public Map<String, FieldValue> getFieldValues() { return fieldValues; }
    public void setFieldValues(Map<String, FieldValue> fieldValues) { this.fieldValues = fieldValues; }
    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }
    public boolean isValid() { return valid; }
    public void setValid(boolean valid) { this.valid = valid; }
    public Instant getInvalidatedAt() { return invalidatedAt; }
    public String getInvalidatedReason() { return invalidatedReason; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public String period() {
        return entityIdentifier.get("period");
    }

    public String employeeId() {
        return entityIdentifier.get("employeeId");
    }
}
