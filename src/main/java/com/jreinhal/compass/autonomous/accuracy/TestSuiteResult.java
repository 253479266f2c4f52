package com.jreinhal.compass.autonomous.accuracy;

import java.util.List;

/**
 * {@code accuracy} is passed over run; errored tests count as not passed.
 */
public record TestSuiteResult(
        String schemaId,
        double accuracy,
        int testsRun,
        int testsPassed,
        int testsFailed,
        int testsErrored,
        List<AccuracyResult> results,
        long durationMs) {

    public static TestSuiteResult empty(String schemaId) {
        return new TestSuiteResult(schemaId, 0.0, 0, 0, 0, 0, List.of(), 0L);
    }
}
