package com.jreinhal.compass.reasoning;

import java.util.Map;

public record ReasoningStep(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {

    public ReasoningStep {
        data = data == null ? Map.of() : data;
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs) {
        return new ReasoningStep(type, label, detail, durationMs, Map.of());
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        return new ReasoningStep(type, label, detail, durationMs, data);
    }

    public enum StepType {
        QUERY_ROUTING,
        PIPELINE_GATE,
        INTENT_ANALYSIS,
        SCHEMA_DISCOVERY,
        RETRIEVAL,
        CALCULATION,
        RESPONSE_ASSEMBLY,
        ACCURACY_TEST,
        OPTIMIZATION,
        ERROR
    }
}
