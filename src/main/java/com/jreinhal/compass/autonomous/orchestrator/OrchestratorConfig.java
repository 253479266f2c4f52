package com.jreinhal.compass.autonomous.orchestrator;

import com.jreinhal.compass.autonomous.accuracy.TestRunOptions;

/**
 * Knobs for one improvement run.
 */
public record OrchestratorConfig(
        int maxIterations,
        double targetAccuracy,
        boolean dryRun,
        boolean skipGroundTruth,
        int maxActionsPerIteration,
        TestRunOptions testOptions) {

    public OrchestratorConfig {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
        if (targetAccuracy < 0.0 || targetAccuracy > 1.0) {
            throw new IllegalArgumentException("targetAccuracy must be within [0, 1]");
        }
        if (maxActionsPerIteration < 1) {
            throw new IllegalArgumentException("maxActionsPerIteration must be at least 1");
        }
        testOptions = testOptions == null ? TestRunOptions.ALL : testOptions;
    }

    public OrchestratorConfig withDryRun(boolean value) {
        return new OrchestratorConfig(maxIterations, targetAccuracy, value, skipGroundTruth, maxActionsPerIteration, testOptions);
    }

    public OrchestratorConfig withSkipGroundTruth(boolean value) {
        return new OrchestratorConfig(maxIterations, targetAccuracy, dryRun, value, maxActionsPerIteration, testOptions);
    }
}
