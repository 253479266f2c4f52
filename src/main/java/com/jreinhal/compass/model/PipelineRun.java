package com.jreinhal.compass.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One run of the autonomous improvement loop for a schema.
 */
@Document(collection = "pipeline_runs")
public class PipelineRun {

    @Id
    private String id;
    @Indexed
    private String schemaId;
    private String documentId;
    private RunStatus status = RunStatus.PENDING;
    private PipelinePhase phase;
    private int iteration;
    private List<Double> accuracyHistory = new ArrayList<>();
    private double bestAccuracy;
    private int testsRun;
    private int testsPassed;
    private List<String> appliedActions = new ArrayList<>();
    private List<String> proposedActions = new ArrayList<>();
    private String error;
    private Instant startedAt;
    private Instant completedAt;

    public enum RunStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED;

        @JsonValue
        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public PipelineRun() {}

    public PipelineRun(String schemaId, String documentId, Instant startedAt) {
        this.schemaId = schemaId;
        this.documentId = documentId;
        this.startedAt = startedAt;
    }

    public void recordAccuracy(double accuracy) {
        this.accuracyHistory.add(accuracy);
        this.bestAccuracy = Math.max(this.bestAccuracy, accuracy);
    }

    public Double lastAccuracy() {
        return accuracyHistory.isEmpty() ? null : accuracyHistory.get(accuracyHistory.size() - 1);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getSchemaId() { return schemaId; }
    public void setSchemaId(String schemaId) { this.schemaId = schemaId; }
    public String getDocumentId() { return documentId; }
    public RunStatus getStatus() { return status; }
    public void setStatus(RunStatus status) { this.status = status; }
    public PipelinePhase getPhase() { return phase; }
    public void setPhase(PipelinePhase phase) { this.phase = phase; }
    public int getIteration() { return iteration; }
    public void setIteration(int iteration) { this.iteration = iteration; }
    public List<Double> getAccuracyHistory() { return accuracyHistory; }
    public double getBestAccuracy() { return bestAccuracy; }
    public int getTestsRun() { return testsRun; }
    public void setTestsRun(int testsRun) { this.testsRun = testsRun; }
    public int getTestsPassed() { return testsPassed; }
    public void setTestsPassed(int testsPassed) { this.testsPassed = testsPassed; }
    public List<String> getAppliedActions() { return appliedActions; }
    public List<String> getProposedActions() { return proposedActions; }
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
}
