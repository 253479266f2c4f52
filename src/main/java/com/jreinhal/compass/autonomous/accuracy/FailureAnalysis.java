package com.jreinhal.compass.autonomous.accuracy;

import java.util.List;

public record FailureAnalysis(
        List<FailurePattern> patterns,
        List<OptimizationSuggestion> suggestions,
        List<String> criticalIssues) {

    public static final FailureAnalysis NONE = new FailureAnalysis(List.of(), List.of(), List.of());
}
