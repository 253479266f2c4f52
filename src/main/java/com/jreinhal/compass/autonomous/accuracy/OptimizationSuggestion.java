package com.jreinhal.compass.autonomous.accuracy;

import com.jreinhal.compass.model.OptimizationActionType;
import java.util.List;
import java.util.Map;

public record OptimizationSuggestion(
        OptimizationActionType actionType,
        String target,
        Map<String, Object> change,
        String reason,
        double confidence,
        double estimatedImprovement,
        List<String> affectedTests) {

    public OptimizationSuggestion {
        change = change == null ? Map.of() : change;
        affectedTests = affectedTests == null ? List.of() : List.copyOf(affectedTests);
    }

    public double score() {
        return confidence * estimatedImprovement;
    }
}
