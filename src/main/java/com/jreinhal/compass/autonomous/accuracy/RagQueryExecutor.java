package com.jreinhal.compass.autonomous.accuracy;

import java.util.Map;

/**
 * Runs a test query through the live query pipeline.
 */
public interface RagQueryExecutor {

    /**
     * @param namespace    namespace the test belongs to
     * @param targetEntity entity the question is about, e.g. {@code employeeId} and {@code period}
     */
    RagExecutionResult execute(String query, String namespace, Map<String, String> targetEntity);
}
