package com.jreinhal.compass.autonomous.accuracy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jreinhal.compass.router.RouteType;
import com.jreinhal.compass.understanding.IntentType;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccuracyResult(
        String testId,
        String query,
        TestStatus status,
        boolean passed,
        double accuracy,
        List<Discrepancy> discrepancies,
        String response,
        Map<String, Object> extractedValues,
        double topScore,
        double avgScore,
        Map<String, Object> filtersUsed,
        String namespace,
        RouteType routeType,
        IntentType intentType,
        double intentConfidence,
        String error,
        long processingTimeMs) {

    static AccuracyResult error(String testId, String query, String namespace, String error, long processingTimeMs) {
        return new AccuracyResult(testId, query, TestStatus.ERROR, false, 0.0, List.of(), null, Map.of(),
                0.0, 0.0, Map.of(), namespace, null, null, 0.0, error, processingTimeMs);
    }
}
