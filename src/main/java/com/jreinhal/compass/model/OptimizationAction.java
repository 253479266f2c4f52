package com.jreinhal.compass.model;

import com.jreinhal.compass.schema.NamespaceOverrides;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Audit record of one optimization suggestion, whether applied, dry-run or rolled back.
 * {@code previousState} holds the namespace overrides as they were before the change.
 */
@Document(collection = "optimization_actions")
public class OptimizationAction {

    @Id
    private String id;
    @Indexed
    private String schemaId;
    @Indexed
    private String pipelineRunId;
    private int iteration;
    private OptimizationActionType actionType;
    private String target;
    private Map<String, Object> change = new LinkedHashMap<>();
    private String reason;
    private double confidence;
    private double estimatedImprovement;
    private List<String> affectedTests = new ArrayList<>();
    private boolean applied;
    private boolean success;
    private String error;
    private Double accuracyBefore;
    private Double accuracyAfter;
    private boolean canRollback;
    private boolean rolledBack;
    private Instant rolledBackAt;
    private NamespaceOverrides previousState;
    private Instant createdAt;

    public OptimizationAction() {
        this.createdAt = Instant.now();
    }

    public void markRolledBack(Instant at) {
        this.rolledBack = true;
        this.rolledBackAt = at;
        this.canRollback = false;
    }

    /**
     * True when the test run after this action scored lower than the run before it.
     */
    public boolean regressed() {
        return accuracyBefore != null && accuracyAfter != null && accuracyAfter < accuracyBefore;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getSchemaId() { return schemaId; }
    public void setSchemaId(String schemaId) { this.schemaId = schemaId; }
    public String getPipelineRunId() { return pipelineRunId; }
    public void setPipelineRunId(String pipelineRunId) { this.pipelineRunId = pipelineRunId; }
    public int getIteration() { return iteration; }
    public void setIteration(int iteration) { this.iteration = iteration; }
    public OptimizationActionType getActionType() { return actionType; }
    public void setActionType(OptimizationActionType actionType) { this.actionType = actionType; }
    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }
    public Map<String, Object> getChange() { return change; }
    public void setChange(Map<String, Object> change) { this.change = change; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }
    public double getEstimatedImprovement() { return estimatedImprovement; }
    public void setEstimatedImprovement(double estimatedImprovement) { this.estimatedImprovement = estimatedImprovement; }
    public List<String> getAffectedTests() { return affectedTests; }
    public void setAffectedTests(List<String> affectedTests) { this.affectedTests = affectedTests; }
    public boolean isApplied() { return applied; }
    public void setApplied(boolean applied) { this.applied = applied; }
    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
    public Double getAccuracyBefore() { return accuracyBefore; }
    public void setAccuracyBefore(Double accuracyBefore) { this.accuracyBefore = accuracyBefore; }
    public Double getAccuracyAfter() { return accuracyAfter; }
    public void setAccuracyAfter(Double accuracyAfter) { this.accuracyAfter = accuracyAfter; }
    public boolean isCanRollback() { return canRollback; }
    public void setCanRollback(boolean canRollback) { this.canRollback = canRollback; }
    public boolean isRolledBack() { return rolledBack; }
    public Instant getRolledBackAt() { return rolledBackAt; }
    public NamespaceOverrides getPreviousState() { return previousState; }
    public void setPreviousState(NamespaceOverrides previousState) { this.previousState = previousState; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
