package com.jreinhal.compass.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A query with the values a correct answer must contain. Generated from ground truth.
 */
@Document(collection = "accuracy_tests")
public class AccuracyTestCase {

    public static final double DEFAULT_TOLERANCE = 0.02;

    @Id
    private String id;
    @Indexed
    private String schemaId;
    @Indexed
    private String groundTruthId;
    private String name;
    private String query;
    private String queryPattern;
    private List<String> queryVariations = new ArrayList<>();
    private String category;
    private TestPriority priority = TestPriority.LOW;
    private Map<String, String> targetEntity = new LinkedHashMap<>();
    private List<String> expectedFields = new ArrayList<>();
    private Map<String, ExpectedValue> expectedValues = new LinkedHashMap<>();
    private double valueTolerance = DEFAULT_TOLERANCE;
    private List<DiscrepancyType> allowedDiscrepancies = new ArrayList<>(List.of(DiscrepancyType.WITHIN_TOLERANCE));
    private boolean active = true;
    private Instant createdAt;

    /**
     * {@code tolerance} only applies to {@link ComparisonType#NUMERIC_RANGE}; when null the
     * test-level {@code valueTolerance} is used.
     */
    public record ExpectedValue(Object value, ComparisonType type, Double tolerance) {}

    public AccuracyTestCase() {
        this.createdAt = Instant.now();
    }

    public double toleranceFor(String field) {
        ExpectedValue expected = expectedValues.get(field);
        if (expected != null && expected.tolerance() != null) {
            return expected.tolerance();
        }
        return valueTolerance;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getSchemaId() { return schemaId; }
    public void setSchemaId(String schemaId) { this.schemaId = schemaId; }
    public String getGroundTruthId() { return groundTruthId; }
    public void setGroundTruthId(String groundTruthId) { this.groundTruthId = groundTruthId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }
    public String getQueryPattern() { return queryPattern; }
    public void setQueryPattern(String queryPattern) { this.queryPattern = queryPattern; }
    public List<String> getQueryVariations() { return queryVariations; }
    public void setQueryVariations(List<String> queryVariations) { this.queryVariations = queryVariations; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public TestPriority getPriority() { return priority; }
    public void setPriority(TestPriority priority) { this.priority = priority; }
    public Map<String, String> getTargetEntity() { return targetEntity; }
    public void setTargetEntity(Map<String, String> targetEntity) { this.targetEntity = targetEntity; }
    public List<String> getExpectedFields() { return expectedFields; }
    public void setExpectedFields(List<String> expectedFields) { this.expectedFields = expectedFields; }
    public Map<String, ExpectedValue> getExpectedValues() { return expectedValues; }
    public void setExpectedValues(Map<String, ExpectedValue> expectedValues) { this.expectedValues = expectedValues; }
    public double getValueTolerance() { return valueTolerance; }
    public void setValueTolerance(double valueTolerance) { this.valueTolerance = valueTolerance; }
    public List<DiscrepancyType> getAllowedDiscrepancies() { return allowedDiscrepancies; }
    public void setAllowedDiscrepancies(List<DiscrepancyType> allowedDiscrepancies) { this.allowedDiscrepancies = allowedDiscrepancies; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
