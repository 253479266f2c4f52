package com.jreinhal.compass.autonomous.accuracy;

/**
 * Where an optimization is being applied. {@code namespace} is the schema id.
 */
public record OptimizationContext(String namespace, String pipelineRunId, int iteration, Double accuracyBefore, boolean dryRun) {

    public static OptimizationContext manual(String namespace) {
        return new OptimizationContext(namespace, null, 0, null, false);
    }
}
