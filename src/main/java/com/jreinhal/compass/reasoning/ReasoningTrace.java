package com.jreinhal.compass.reasoning;

import java.time.Instant;
import java.util.*;

/**
 * Complete reasoning trace for one query through the pipeline.
 *
 * Holds the routing, gating, understanding, retrieval and calculation steps together with
 * their timings and any metrics recorded along the way.
 */
public class ReasoningTrace {

    private final String traceId;
    private final Instant timestamp;
    private final String query;
    private final List<String> namespaces;
    private final String userId;
    private final List<ReasoningStep> steps;
    private final Map<String, Object> metrics;
    private long totalDurationMs;
    private boolean completed;

    public ReasoningTrace(String query, List<String> namespaces) {
        this(query, namespaces, null);
    }

    public ReasoningTrace(String query, List<String> namespaces, String userId) {
        this.traceId = UUID.randomUUID().toString().substring(0, 8);
        this.timestamp = Instant.now();
        this.query = query;
        this.namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
        this.userId = userId;
        this.steps = new ArrayList<>();
        this.metrics = new LinkedHashMap<>();
        this.totalDurationMs = 0;
        this.completed = false;
    }

    /**
     * Add a reasoning step to the trace.
     */
    public void addStep(ReasoningStep step) {
        steps.add(step);
        totalDurationMs += step.durationMs();
    }

    public void addMetric(String key, Object value) {
        metrics.put(key, value);
    }

    public void complete() {
        this.completed = true;
    }

    public String getTraceId() {
        return traceId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getQuery() {
        return query;
    }

    public List<String> getNamespaces() {
        return namespaces;
    }

    public String getUserId() {
        return userId;
    }

    public List<ReasoningStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public Map<String, Object> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public long getTotalDurationMs() {
        return totalDurationMs;
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Convert to a map for JSON serialization.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("traceId", traceId);
        map.put("timestamp", timestamp.toString());
        map.put("query", query);
        map.put("namespaces", namespaces);
        map.put("totalDurationMs", totalDurationMs);
        map.put("completed", completed);
        map.put("steps", getStepsAsMaps());
        if (!metrics.isEmpty()) {
            map.put("metrics", metrics);
        }
        return map;
    }

    /**
     * Get a summary string for logging.
     */
    public String getSummary() {
        return String.format("Trace[%s]: %d steps, %dms total, %s",
                traceId, steps.size(), totalDurationMs, completed ? "COMPLETED" : "IN_PROGRESS");
    }

    public List<Map<String, Object>> getStepsAsMaps() {
        List<Map<String, Object>> stepMaps = new ArrayList<>();
        for (ReasoningStep step : steps) {
            Map<String, Object> stepMap = new LinkedHashMap<>();
            stepMap.put("type", step.type().name().toLowerCase(Locale.ROOT));
            stepMap.put("label", step.label());
            stepMap.put("detail", step.detail());
            stepMap.put("durationMs", step.durationMs());
            if (!step.data().isEmpty()) {
                stepMap.put("data", step.data());
            }
            stepMaps.add(stepMap);
        }
        return stepMaps;
    }
}
